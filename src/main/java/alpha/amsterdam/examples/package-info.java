/**
 * Runnable examples.
 */
package alpha.amsterdam.examples;

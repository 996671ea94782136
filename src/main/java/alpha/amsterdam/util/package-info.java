/**
 * Utilities.
 */
package alpha.amsterdam.util;

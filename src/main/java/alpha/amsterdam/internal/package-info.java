/**
 * Implementation of channels; the lock-guarded queue and its typed facade.
 */
package alpha.amsterdam.internal;

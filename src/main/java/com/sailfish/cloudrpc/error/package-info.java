/**
 * Exception types surfaced to callers. Every error carries a {@link com.sailfish.cloudrpc.model.StatusCode};
 * the subclasses tell terminal outcomes of a retrying call apart.
 */
package com.sailfish.cloudrpc.error;

/**
 * Provides the asynchronous RPC execution core shared by the table and object storage clients.
 * This includes the call and continuation contracts, the completion queue, and the retrying call
 * that turns many internal attempts into one terminal result.
 */
package com.sailfish.cloudrpc;

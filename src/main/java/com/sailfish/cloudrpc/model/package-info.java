/**
 * Value types shared by the queue and the retry layer: operation identifiers, pending operation records,
 * results, status codes and call states.
 */
package com.sailfish.cloudrpc.model;

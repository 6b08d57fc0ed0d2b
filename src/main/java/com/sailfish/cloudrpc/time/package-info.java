/**
 * Clock abstraction used for elapsed-time accounting and delayed wake-ups.
 */
package com.sailfish.cloudrpc.time;

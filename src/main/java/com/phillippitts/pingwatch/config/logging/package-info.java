/**
 * Logging support: the servlet filter that seeds Log4j2's ThreadContext per request.
 */
package com.phillippitts.pingwatch.config.logging;

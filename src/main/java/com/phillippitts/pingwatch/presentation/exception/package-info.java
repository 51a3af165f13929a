/**
 * Maps domain exceptions to HTTP responses.
 */
package com.phillippitts.pingwatch.presentation.exception;

/**
 * Service layer: monitoring, probing, tracing, export, metrics and health.
 */
package com.phillippitts.pingwatch.service;

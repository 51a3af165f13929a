/**
 * REST controllers under {@code /api}: monitoring session, disruption log, trace runs and
 * file export.
 */
package com.phillippitts.pingwatch.presentation.controller;

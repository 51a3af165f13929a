/**
 * File export and import: monitoring reports, address lists and trace transcripts.
 */
package com.phillippitts.pingwatch.service.export;

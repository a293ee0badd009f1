/**
 * Inbound engine telemetry over OSC/UDP.
 */
package com.phillippitts.granupose.service.telemetry;

/**
 * Spring configuration: typed properties per subsystem, thread pools, gateway wiring and
 * the beans behind the service seams (clock, UDP transports, process launching, scheduling).
 */
package com.phillippitts.granupose.config;

/**
 * Immutable domain records shared by services and the gateway: OSC messages and send
 * outcomes ({@code domain.osc}), telemetry samples ({@code domain.telemetry}) and engine
 * state ({@code domain.engine}).
 */
package com.phillippitts.granupose.domain;

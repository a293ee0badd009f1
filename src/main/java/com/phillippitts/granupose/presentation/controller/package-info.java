/**
 * REST controllers of the transport gateway: bridge status and parameter control,
 * engine lifecycle and telemetry inspection.
 */
package com.phillippitts.granupose.presentation.controller;

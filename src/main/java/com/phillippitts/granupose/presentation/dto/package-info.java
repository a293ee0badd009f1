/**
 * Request and response bodies of the gateway, shared by the REST controllers and the
 * WebSocket handler. Request records carry the Jakarta Bean Validation constraints.
 */
package com.phillippitts.granupose.presentation.dto;

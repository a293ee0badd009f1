/**
 * Presentation layer: the transport gateway (REST controllers, WebSocket handler,
 * request/response DTOs and exception handling).
 *
 * <p>This package is the HTTP/WebSocket boundary of the application, following a
 * 3-tier architecture where presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.websocket} - {@code /ws} endpoint, inbound commands and lossy broadcasts</li>
 *   <li>{@code presentation.dto} - request/response records with Bean Validation constraints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Controllers are thin adapters - business logic lives in services</li>
 *   <li>Exception handlers map domain exceptions to HTTP status codes</li>
 *   <li>Transport-not-ready and rate-limit drops are results, not exceptions</li>
 * </ul>
 *
 * @see com.phillippitts.granupose.presentation.controller
 * @see com.phillippitts.granupose.presentation.websocket.BridgeWebSocketHandler
 */
package com.phillippitts.granupose.presentation;

/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP/REST boundary of the application. Presentation depends on
 * service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - project, audio and archive endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they wait on the service futures and let domain exceptions
 * reach {@link com.phillippitts.acedaw.presentation.exception.GlobalExceptionHandler} unwrapped.
 *
 * @since 1.0
 */
package com.phillippitts.acedaw.presentation;

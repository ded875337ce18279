/**
 * Service layer containing the project library's business logic.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.project} - project records, JSON mapping and lifecycle</li>
 *   <li>{@code service.audio} - audio blob keys and storage, WAV decoding and encoding</li>
 *   <li>{@code service.isolation} - single-track isolation from cumulative mixes</li>
 *   <li>{@code service.archive} - the {@code .acedaw} archive format, export and import</li>
 *   <li>{@code service.metrics}, {@code service.health} - Actuator instrumentation</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are stateless Spring beans using constructor injection</li>
 *   <li>Storage-facing operations return {@link java.util.concurrent.CompletableFuture}</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.acedaw.service;

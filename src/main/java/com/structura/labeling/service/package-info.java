/**
 * Labeling services: remote invocation, hybrid triggers, label merging and orchestration.
 *
 * <p>Components, leaf first:
 * <ol>
 *   <li>{@code service.remote} - timeout and retry policies, failure classification, transport
 *       and the resilient {@link com.structura.labeling.service.remote.RemoteClassifierClient}</li>
 *   <li>{@code service.trigger} - decides which paragraphs a hybrid run sends for review</li>
 *   <li>{@code service.merge} - reconciles remote labels with deterministic labels</li>
 *   <li>{@code service.orchestration} - mode state machine producing the final label set</li>
 * </ol>
 */
package com.structura.labeling.service;

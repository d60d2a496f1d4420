/**
 * Protocol-centric core for the generative language client.
 *
 * <p>This module is deliberately library-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants, URL and model-path rules, {@link io.generativeai.core.RequestOptions}</li>
 *   <li>The typed error hierarchy rooted at {@link io.generativeai.core.GenerativeAIException}</li>
 *   <li>Immutable request and response schema types</li>
 * </ul>
 *
 * <p>JSON and HTTP bindings live in other modules.
 */
package io.generativeai.core;

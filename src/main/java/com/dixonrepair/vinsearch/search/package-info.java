/**
 * Tiered web search: providers, retry policy and the executor.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code SearchExecutor} - Runs tiers concurrently and decides escalation</li>
 *   <li>{@code RetryPolicy} - Exponential backoff with jitter for transient failures</li>
 *   <li>{@code TavilySearchProvider}, {@code SerperSearchProvider} - WebClient-based providers</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.dixonrepair.vinsearch.search;

/**
 * Root package of the pbi-rest library, an asynchronous client for the Power BI REST API.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.pbirest.core.PowerBiClient} – entry point holding the credential, the
 *       token cache and the retry configuration.
 *   <li>{@link com.example.pbirest.core.PowerBiSession} – typed operations: listing, lookups,
 *       schedules, refresh history, refreshes and DAX queries.
 *   <li>{@link com.example.pbirest.core.PowerBiSettings} – endpoints and timeouts resolved from
 *       system properties and environment variables.
 *   <li>{@link com.example.pbirest.core.auth} – credentials and the token cache.
 *   <li>{@link com.example.pbirest.core.http} – the authenticated request layer, the transport and
 *       the conflict and rate-limit retry policies.
 *   <li>{@link com.example.pbirest.core.resources} – groups, datasets, dataflows, reports, pages,
 *       schedules and refresh history entries, with flat-row export.
 *   <li>{@link com.example.pbirest.core.refresh} – the refresh orchestrator.
 *   <li>{@link com.example.pbirest.core.query} – DAX query execution.
 * </ul>
 */
package com.example.pbirest.core;

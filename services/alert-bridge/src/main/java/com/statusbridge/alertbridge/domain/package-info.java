/**
 * Domain layer: alert events, per-target and per-service health, and the incident lifecycle.
 *
 * <p>This package follows Hexagonal Architecture:
 *
 * <ul>
 *   <li>Domain MUST NOT depend on infrastructure or api packages
 *   <li>Domain contains pure business logic with no framework dependencies
 *   <li>The status page is reached only through {@link
 *       com.statusbridge.alertbridge.domain.ports.StatusPageGateway}
 * </ul>
 *
 * <p>Locking: each target and each service has its own lock. No gateway call is made while a
 * lock is held; results are applied under a short re-acquired lock once the backend confirmed
 * them.
 */
package com.statusbridge.alertbridge.domain;

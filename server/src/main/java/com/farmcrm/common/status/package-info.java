/**
 * Result types for the data-access layer.
 *
 * <p>{@link com.farmcrm.common.status.StatusOr} carries either a value or a failed {@link
 * com.farmcrm.common.status.Status}. Not-found is an OK result with an empty value; failures keep
 * their {@link com.farmcrm.common.status.StatusCode} and cause so a caller can tell an unreachable
 * store from a rejected statement.
 *
 * <pre>
 * StatusOr&lt;Optional&lt;Farmer&gt;&gt; farmerOr = service.getFarmer(42);
 * if (farmerOr.isNotOk()) {
 *   Logger.error("Lookup failed: {}", farmerOr.getStatus());
 * } else if (farmerOr.getValue().isEmpty()) {
 *   // no such farmer
 * }
 * </pre>
 */
package com.farmcrm.common.status;

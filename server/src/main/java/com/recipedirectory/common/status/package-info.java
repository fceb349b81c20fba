/**
 * Status and result types shared by the store helpers, services and REST adapters.
 *
 * <ul>
 *   <li>{@link com.recipedirectory.common.status.StatusCode} - error codes, each mapped to the HTTP
 *       status the REST layer replies with
 *   <li>{@link com.recipedirectory.common.status.Status} - a code with an optional message and cause
 *   <li>{@link com.recipedirectory.common.status.StatusOr} - either a value or an error status
 * </ul>
 *
 * <p>Example:
 *
 * <pre>
 * StatusOr&lt;Optional&lt;Recipe&gt;&gt; recipeOr = Recipes.loadById(database, recipeId);
 * if (recipeOr.isNotOk()) {
 *   return StatusOr.ofStatus(recipeOr.getStatus());
 * }
 * if (recipeOr.getValue().isEmpty()) {
 *   return StatusOr.ofStatus(Status.notFound("Recipe not found"));
 * }
 * </pre>
 */
package com.recipedirectory.common.status;

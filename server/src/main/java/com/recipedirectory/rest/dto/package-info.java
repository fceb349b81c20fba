/**
 * Request and response bodies of the Recipe Directory REST API.
 *
 * <p>All DTOs are Java records. Request records are bound from JSON by Jackson; unknown
 * properties are ignored. Response records follow the wire shapes existing clients rely on:
 *
 * <ul>
 *   <li>identifiers are 24-character hex strings in an {@code _id} property
 *   <li>timestamps are ISO-8601 strings
 *   <li>create and update responses wrap the entity together with a {@code message}
 *   <li>list endpoints return bare JSON arrays
 * </ul>
 *
 * <p>Error bodies are not modelled here: adapters reply with {@code {"error": ...}} or
 * {@code {"message": ...}} maps, see {@link com.recipedirectory.rest.RestAdapter}.
 */
package com.recipedirectory.rest.dto;

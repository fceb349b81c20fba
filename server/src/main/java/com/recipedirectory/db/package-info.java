/**
 * The document store layer.
 *
 * <p>Each collection has a record class ({@code User}, {@code Recipe}, {@code ArchivedRecipe}) and
 * a helper class with a plural name ({@code Users}, {@code Recipes}, {@code ArchivedRecipes})
 * whose static methods take the {@link com.mongodb.client.MongoDatabase} handle explicitly and
 * return {@code StatusOr<T>}. Helpers never throw for driver failures.
 */
package com.recipedirectory.db;

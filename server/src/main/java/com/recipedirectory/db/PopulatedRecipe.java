package com.recipedirectory.db;

import javax.annotation.Nullable;

/**
 * A recipe together with its resolved author.
 *
 * @param recipe The recipe
 * @param author The user referenced by {@code recipe.authorId()}, or null when no such user exists
 */
public record PopulatedRecipe(Recipe recipe, @Nullable User author) {}

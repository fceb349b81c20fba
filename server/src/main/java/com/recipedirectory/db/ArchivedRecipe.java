package com.recipedirectory.db;

import java.time.Instant;

/**
 * Represents a document in the 'archivedrecipes' collection: a full copy of a deleted recipe,
 * stored under the recipe's own identifier, plus the time it was archived.
 *
 * @param recipe The recipe as it was when it was archived
 * @param archivedAt Timestamp when the copy was written
 */
public record ArchivedRecipe(Recipe recipe, Instant archivedAt) {}

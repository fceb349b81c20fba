package com.recipedirectory.db;

import java.time.Instant;
import java.util.List;
import org.bson.types.ObjectId;

/**
 * Represents a document in the 'recipes' collection.
 *
 * @param recipeId The unique identifier of the recipe
 * @param title The recipe title, at least three characters
 * @param description Free-text description (optional)
 * @param ingredients Ordered ingredient lines; null only while a recipe is being validated
 * @param instructions Preparation instructions
 * @param authorId The user who wrote the recipe. Not checked against the users collection.
 * @param views Number of times the recipe has been viewed
 * @param createdAt Timestamp when the document was created
 */
public record Recipe(
    ObjectId recipeId,
    String title,
    String description,
    List<String> ingredients,
    String instructions,
    ObjectId authorId,
    long views,
    Instant createdAt) {}

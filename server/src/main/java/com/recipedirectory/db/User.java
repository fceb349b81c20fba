package com.recipedirectory.db;

import java.time.Instant;
import org.bson.types.ObjectId;

/**
 * Represents a document in the 'users' collection.
 *
 * @param userId The unique identifier of the user
 * @param name The user's name, at least three characters
 * @param email The email address, unique across users
 * @param createdAt Timestamp when the document was created
 */
public record User(ObjectId userId, String name, String email, Instant createdAt) {}

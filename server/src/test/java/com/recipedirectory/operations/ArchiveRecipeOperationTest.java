package com.recipedirectory.operations;

import static org.junit.jupiter.api.Assertions.*;

import com.recipedirectory.operations.ArchiveRecipeOperation.ArchiveResult;
import org.junit.jupiter.api.Test;

/** Test for the ArchiveRecipeOperation result class. */
class ArchiveRecipeOperationTest {

  @Test
  void testArchiveResultSuccess() {
    ArchiveResult result = ArchiveResult.success();

    assertTrue(result.isSuccess());
    assertTrue(result.archived());
    assertTrue(result.deleted());
    assertNull(result.errorMessage());
  }

  @Test
  void testArchiveResultNotFound() {
    ArchiveResult nothingFound = ArchiveResult.notFound(false);
    assertTrue(nothingFound.isSuccess());
    assertFalse(nothingFound.archived());
    assertFalse(nothingFound.deleted());

    ArchiveResult lostRace = ArchiveResult.notFound(true);
    assertTrue(lostRace.isSuccess());
    assertTrue(lostRace.archived());
    assertFalse(lostRace.deleted());
  }

  @Test
  void testArchiveResultError() {
    ArchiveResult result = ArchiveResult.error("Recipe x is already archived");

    assertFalse(result.isSuccess());
    assertFalse(result.deleted());
    assertEquals("Recipe x is already archived", result.errorMessage());
  }
}

/**
 * The persistent key-value substrate.
 *
 * <p>{@link com.phillippitts.acedaw.storage.KeyValueStore} is the only seam between the project
 * library and physical storage. Two implementations ship: a directory-backed store for normal
 * operation and an in-memory store for tests and throwaway sessions.
 *
 * @since 1.0
 */
package com.phillippitts.acedaw.storage;

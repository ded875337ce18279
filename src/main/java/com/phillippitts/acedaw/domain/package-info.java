/**
 * Domain models for the project library.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.acedaw.domain.Project} - an editing project: identity, name,
 *       timestamps, ordered tracks and opaque editor state</li>
 *   <li>{@link com.phillippitts.acedaw.domain.Track} - one layer of the stack, kept as the JSON the
 *       editor produced</li>
 *   <li>{@link com.phillippitts.acedaw.domain.ProjectSummary} - derived listing row</li>
 * </ul>
 *
 * <p>All models are immutable and validate in their constructors.
 *
 * @since 1.0
 */
package com.phillippitts.acedaw.domain;

package com.phillippitts.acedaw.presentation.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/projects}.
 */
record CreateProjectRequest(
        @NotBlank(message = "Project name must not be blank")
        @Size(max = 200, message = "Project name must be at most 200 characters")
        String name
) {}

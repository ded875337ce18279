package com.phillippitts.acedaw.presentation.controller;

import com.phillippitts.acedaw.domain.Project;
import com.phillippitts.acedaw.domain.ProjectSummary;
import com.phillippitts.acedaw.service.project.ProjectJsonMapper;
import com.phillippitts.acedaw.service.project.ProjectLibraryService;
import jakarta.validation.Valid;
import org.json.JSONObject;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.phillippitts.acedaw.util.FutureUtils.await;

/**
 * Project library endpoints.
 *
 * <p>Project bodies are passed through as raw JSON text so fields the server does not model
 * (tracks, generation defaults) survive unchanged.
 */
@RestController
@RequestMapping("/api/projects")
class ProjectController {

    private final ProjectLibraryService library;

    ProjectController(ProjectLibraryService library) {
        this.library = library;
    }

    @GetMapping
    List<ProjectSummary> list() {
        return await(library.list());
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> create(@Valid @RequestBody CreateProjectRequest request) {
        Project created = await(library.create(request.name()));
        return ResponseEntity.status(HttpStatus.CREATED).body(render(created));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    String load(@PathVariable String id) {
        return render(await(library.open(id)));
    }

    @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    String save(@PathVariable String id, @RequestBody String body) {
        Project project = ProjectJsonMapper.fromJson(new JSONObject(body));
        if (!project.id().equals(id)) {
            throw new IllegalArgumentException("Project id '" + project.id() + "' does not match path id '" + id + "'");
        }
        return render(await(library.save(project)));
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> delete(@PathVariable String id) {
        await(library.deleteWithAudio(id));
        return ResponseEntity.noContent().build();
    }

    private static String render(Project project) {
        return ProjectJsonMapper.toJson(project).toString();
    }
}

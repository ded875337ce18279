package com.phillippitts.acedaw.presentation.controller;

import com.phillippitts.acedaw.domain.Project;
import com.phillippitts.acedaw.service.archive.ArchiveFormat;
import com.phillippitts.acedaw.service.archive.ProjectArchive;
import com.phillippitts.acedaw.service.archive.ProjectArchiveService;
import com.phillippitts.acedaw.service.project.ProjectJsonMapper;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

import static com.phillippitts.acedaw.util.FutureUtils.await;

/**
 * {@code .acedaw} download and upload.
 */
@RestController
class ArchiveController {

    private final ProjectArchiveService archives;

    ArchiveController(ProjectArchiveService archives) {
        this.archives = archives;
    }

    @GetMapping("/api/projects/{id}/archive")
    ResponseEntity<byte[]> export(@PathVariable String id) {
        ProjectArchive archive = await(archives.exportProject(id));
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(ArchiveFormat.CONTENT_TYPE))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(archive.fileName(), StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .body(archive.bytes());
    }

    @PostMapping(value = "/api/archives", consumes = MediaType.ALL_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> importArchive(@RequestBody byte[] archive) {
        Project project = await(archives.importArchive(archive));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ProjectJsonMapper.toJson(project).toString());
    }
}

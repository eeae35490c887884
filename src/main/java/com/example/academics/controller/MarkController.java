package com.example.academics.controller;

import com.example.academics.dto.MarkEntryRequest;
import com.example.academics.entities.Mark;
import com.example.academics.service.MarkEntryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;

import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Mark entry for teachers. Rejected marks come back as 400 through {@link GlobalExceptionHandler}.
 */
@Controller
@RequiredArgsConstructor
@RequestMapping("/teacher/marks")
public class MarkController {

    private final MarkEntryService markEntryService;

    @PostMapping
    @ResponseBody
    public ResponseEntity<?> recordMark(@RequestBody MarkEntryRequest request, Principal principal) {
        Mark saved = markEntryService.recordMark(principal.getName(), request);
        return ResponseEntity.ok(Map.of("success", true, "id", saved.getId()));
    }

    @PostMapping("/batch")
    @ResponseBody
    public ResponseEntity<?> recordMarks(@RequestBody List<MarkEntryRequest> requests, Principal principal) {
        List<Mark> saved = markEntryService.recordMarks(principal.getName(), requests);
        List<Long> ids = saved.stream().map(Mark::getId).collect(Collectors.toList());
        return ResponseEntity.ok(Map.of("success", true, "saved", ids.size(), "ids", ids));
    }

    @DeleteMapping("/{id}")
    @ResponseBody
    public ResponseEntity<?> deleteMark(@PathVariable Long id) {
        markEntryService.deleteMark(id);
        return ResponseEntity.ok(Map.of("success", true));
    }
}

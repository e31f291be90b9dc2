package com.newsdigest.bot.controller;

import com.newsdigest.bot.dto.ControlResponse;
import com.newsdigest.bot.dto.DigestCycleDTO;
import com.newsdigest.bot.dto.DigestStatusDto;
import com.newsdigest.bot.dto.NewsItemDTO;
import com.newsdigest.bot.dto.PageResponse;
import com.newsdigest.bot.entity.ItemState;
import com.newsdigest.bot.mapper.DigestMapper;
import com.newsdigest.bot.service.CycleLogService;
import com.newsdigest.bot.service.ControlResult;
import com.newsdigest.bot.service.DigestControlService;
import com.newsdigest.bot.service.ItemStore;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 관리자 제어 API. ADMIN 권한 필요.
 */
@RestController
@RequestMapping("/api/v1/admin/digest")
@RequiredArgsConstructor
public class DigestControlController {

    private static final int MAX_PAGE_SIZE = 100;

    private final DigestControlService controlService;
    private final CycleLogService cycleLogService;
    private final ItemStore itemStore;
    private final DigestMapper digestMapper;

    @PostMapping("/pause")
    public ResponseEntity<ControlResponse> pause() {
        return toResponse("pause", controlService.pause());
    }

    @PostMapping("/resume")
    public ResponseEntity<ControlResponse> resume() {
        return toResponse("resume", controlService.resume());
    }

    @PostMapping("/trigger")
    public ResponseEntity<ControlResponse> trigger() {
        return toResponse("trigger", controlService.triggerNow());
    }

    @GetMapping("/status")
    public ResponseEntity<DigestStatusDto> status() {
        return ResponseEntity.ok(controlService.status());
    }

    @GetMapping("/cycles")
    public ResponseEntity<PageResponse<DigestCycleDTO>> cycles(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), clampSize(size));
        return ResponseEntity.ok(digestMapper.toPage(cycleLogService.recent(pageable), digestMapper::toCycleDto));
    }

    @GetMapping("/items")
    public ResponseEntity<PageResponse<NewsItemDTO>> items(
            @RequestParam(defaultValue = "FAILED") ItemState state,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), clampSize(size), Sort.by(Sort.Direction.DESC, "id"));
        return ResponseEntity.ok(digestMapper.toPage(itemStore.listByState(state, pageable), digestMapper::toItemDto));
    }

    private ResponseEntity<ControlResponse> toResponse(String command, ControlResult result) {
        ControlResponse body = new ControlResponse(command, result, controlService.isPaused());
        HttpStatus status = switch (result) {
            case QUEUED, ALREADY_QUEUED -> HttpStatus.ACCEPTED;
            case BUSY -> HttpStatus.CONFLICT;
            default -> HttpStatus.OK;
        };
        return ResponseEntity.status(status).body(body);
    }

    private int clampSize(int size) {
        return Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
    }
}

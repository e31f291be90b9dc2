package com.newsdigest.bot.controller;

import com.newsdigest.bot.config.SecurityConfig;
import com.newsdigest.bot.dto.DigestStatusDto;
import com.newsdigest.bot.entity.CycleOutcome;
import com.newsdigest.bot.entity.CycleTrigger;
import com.newsdigest.bot.entity.DigestCycle;
import com.newsdigest.bot.entity.ItemState;
import com.newsdigest.bot.entity.NewsItem;
import com.newsdigest.bot.mapper.DigestMapper;
import com.newsdigest.bot.service.ControlResult;
import com.newsdigest.bot.service.CycleLogService;
import com.newsdigest.bot.service.CyclePhase;
import com.newsdigest.bot.service.DigestControlService;
import com.newsdigest.bot.service.ItemStore;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DigestControlController.class)
@Import({SecurityConfig.class, DigestMapper.class})
@ActiveProfiles("test")
class DigestControlControllerTest {

    private static final String SECRET = "test-secret-key-for-jwt-signing-0123456789";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DigestControlService controlService;

    @MockBean
    private CycleLogService cycleLogService;

    @MockBean
    private ItemStore itemStore;

    private static String token(String subject, String role) {
        String jwt = Jwts.builder()
                .subject(subject)
                .claim("role", role)
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
        return "Bearer " + jwt;
    }

    private static String adminToken() {
        return token("42", "admin");
    }

    @Test
    @DisplayName("토큰 없이 호출하면 401")
    void unauthenticated() throws Exception {
        mockMvc.perform(post("/api/v1/admin/digest/pause"))
                .andExpect(status().isUnauthorized());

        verify(controlService, never()).pause();
    }

    @Test
    @DisplayName("서명이 맞지 않는 토큰은 401")
    void invalidSignature() throws Exception {
        String forged = Jwts.builder()
                .subject("42")
                .claim("role", "admin")
                .signWith(Keys.hmacShaKeyFor("another-secret-key-that-is-long-enough-000".getBytes(StandardCharsets.UTF_8)))
                .compact();

        mockMvc.perform(post("/api/v1/admin/digest/pause").header(HttpHeaders.AUTHORIZATION, "Bearer " + forged))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("예전 기본 키로 서명한 토큰은 401")
    void formerDefaultSecretRejected() throws Exception {
        String forged = Jwts.builder()
                .subject("42")
                .claim("role", "admin")
                .signWith(Keys.hmacShaKeyFor("change-me-to-a-secret-of-at-least-32-bytes".getBytes(StandardCharsets.UTF_8)))
                .compact();

        mockMvc.perform(post("/api/v1/admin/digest/pause").header(HttpHeaders.AUTHORIZATION, "Bearer " + forged))
                .andExpect(status().isUnauthorized());

        verify(controlService, never()).pause();
    }

    @Test
    @DisplayName("관리자가 아닌 사용자는 403")
    void notAdmin() throws Exception {
        mockMvc.perform(post("/api/v1/admin/digest/pause").header(HttpHeaders.AUTHORIZATION, token("7", "admin")))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/api/v1/admin/digest/pause").header(HttpHeaders.AUTHORIZATION, token("42", "user")))
                .andExpect(status().isForbidden());

        verify(controlService, never()).pause();
    }

    @Test
    @DisplayName("pause 성공은 200, 일시정지 상태 포함")
    void pause() throws Exception {
        when(controlService.pause()).thenReturn(ControlResult.OK);
        when(controlService.isPaused()).thenReturn(true);

        mockMvc.perform(post("/api/v1/admin/digest/pause").header(HttpHeaders.AUTHORIZATION, adminToken()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.command").value("pause"))
                .andExpect(jsonPath("$.result").value("OK"))
                .andExpect(jsonPath("$.paused").value(true));
    }

    @Test
    @DisplayName("사이클 진행 중 resume은 409 BUSY")
    void resumeBusy() throws Exception {
        when(controlService.resume()).thenReturn(ControlResult.BUSY);

        mockMvc.perform(post("/api/v1/admin/digest/resume").header(HttpHeaders.AUTHORIZATION, adminToken()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.result").value("BUSY"));
    }

    @Test
    @DisplayName("trigger는 202, 이미 대기 중이어도 202")
    void trigger() throws Exception {
        when(controlService.triggerNow()).thenReturn(ControlResult.QUEUED, ControlResult.ALREADY_QUEUED);

        mockMvc.perform(post("/api/v1/admin/digest/trigger").header(HttpHeaders.AUTHORIZATION, adminToken()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.result").value("QUEUED"));
        mockMvc.perform(post("/api/v1/admin/digest/trigger").header(HttpHeaders.AUTHORIZATION, adminToken()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.result").value("ALREADY_QUEUED"));
    }

    @Test
    @DisplayName("status 조회")
    void statusSnapshot() throws Exception {
        when(controlService.status()).thenReturn(new DigestStatusDto(
                CyclePhase.IDLE, false, false, true, 1_800_000L, LocalDateTime.of(2026, 10, 19, 12, 30),
                null, null, Map.of(ItemState.POSTED, 5L), List.of()));

        mockMvc.perform(get("/api/v1/admin/digest/status").header(HttpHeaders.AUTHORIZATION, adminToken()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("IDLE"))
                .andExpect(jsonPath("$.paused").value(false))
                .andExpect(jsonPath("$.scheduleEnabled").value(true))
                .andExpect(jsonPath("$.intervalMs").value(1800000))
                .andExpect(jsonPath("$.nextScheduledRun").value("2026-10-19T12:30:00"))
                .andExpect(jsonPath("$.itemCounts.POSTED").value(5));
    }

    @Test
    @DisplayName("최근 사이클 목록은 페이지로 반환")
    void cycles() throws Exception {
        DigestCycle cycle = DigestCycle.builder()
                .id(9L)
                .trigger(CycleTrigger.SCHEDULED)
                .startedAt(LocalDateTime.now().minusMinutes(1))
                .finishedAt(LocalDateTime.now())
                .outcome(CycleOutcome.PARTIAL)
                .itemsPosted(3)
                .sourcesFailed(1)
                .errorSummary("source broken: HTTP 503")
                .build();
        when(cycleLogService.recent(any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(cycle), PageRequest.of(0, 20), 1));

        mockMvc.perform(get("/api/v1/admin/digest/cycles").header(HttpHeaders.AUTHORIZATION, adminToken()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].id").value(9))
                .andExpect(jsonPath("$.content[0].outcome").value("PARTIAL"))
                .andExpect(jsonPath("$.totalElements").value(1));
    }

    @Test
    @DisplayName("상태별 아이템 조회 (기본값 FAILED)")
    void items() throws Exception {
        NewsItem item = NewsItem.builder()
                .id(1L)
                .sourceId("feed")
                .itemKey("k1")
                .title("Broken")
                .state(ItemState.FAILED)
                .attempts(1)
                .lastError("llm AUTH_ERROR: 401")
                .build();
        when(itemStore.listByState(eq(ItemState.FAILED), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(item), PageRequest.of(0, 20), 1));

        mockMvc.perform(get("/api/v1/admin/digest/items").header(HttpHeaders.AUTHORIZATION, adminToken()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].title").value("Broken"))
                .andExpect(jsonPath("$.content[0].state").value("FAILED"));
    }

    @Test
    @DisplayName("알 수 없는 상태 값은 400")
    void invalidState() throws Exception {
        mockMvc.perform(get("/api/v1/admin/digest/items").param("state", "DONE")
                        .header(HttpHeaders.AUTHORIZATION, adminToken()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_PARAMETER"));
    }
}

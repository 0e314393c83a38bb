package com.focusflow.backend.modules.mode.presentation;

import java.util.List;

import com.focusflow.backend.modules.mode.application.FocusModeCatalogService;
import com.focusflow.backend.modules.mode.application.FocusModeCatalogService.CreateModeCommand;
import com.focusflow.backend.modules.mode.application.ModeStateView;
import com.focusflow.backend.modules.mode.application.SessionLifecycleService;
import com.focusflow.backend.modules.mode.application.SessionLifecycleService.FinalizeResult;
import com.focusflow.backend.modules.mode.application.SessionLifecycleService.MessageHandlingResult;
import com.focusflow.backend.modules.mode.application.SessionLifecycleService.ModeSummaryView;
import com.focusflow.backend.modules.mode.application.SessionLifecycleService.SetModeResult;
import com.focusflow.backend.modules.mode.application.SessionLifecycleService.StartResult;
import com.focusflow.backend.modules.mode.presentation.dto.CreateFocusModeRequest;
import com.focusflow.backend.modules.mode.presentation.dto.FocusModeResponse;
import com.focusflow.backend.modules.mode.presentation.dto.IncomingMessageRequest;
import com.focusflow.backend.modules.mode.presentation.dto.SetModeRequest;
import com.focusflow.backend.modules.mode.presentation.dto.StartFocusRequest;
import com.focusflow.backend.modules.mode.presentation.dto.StopFocusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/modes")
public class ModeController {

    private final SessionLifecycleService lifecycleService;
    private final FocusModeCatalogService catalogService;
    private final IncomingMessageResolver messageResolver;

    public ModeController(
            SessionLifecycleService lifecycleService,
            FocusModeCatalogService catalogService,
            IncomingMessageResolver messageResolver
    ) {
        this.lifecycleService = lifecycleService;
        this.catalogService = catalogService;
        this.messageResolver = messageResolver;
    }

    @Operation(summary = "집중 모드 목록 조회")
    @GetMapping
    public ResponseEntity<List<FocusModeResponse>> listModes() {
        List<FocusModeResponse> modes = catalogService.listModes().stream()
                .map(FocusModeResponse::from)
                .toList();
        return ResponseEntity.ok(modes);
    }

    @Operation(summary = "집중 모드 추가", description = "slug를 생략하면 이름에서 만든다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "생성 성공"),
            @ApiResponse(responseCode = "409", description = "이름 또는 slug 중복 – code 값이 `mode.catalog_duplicate`")
    })
    @PostMapping
    public ResponseEntity<FocusModeResponse> createMode(@Valid @RequestBody CreateFocusModeRequest request) {
        CreateModeCommand command = new CreateModeCommand(
                request.name(),
                request.durationMinutes(),
                request.description(),
                request.slug()
        );
        return ResponseEntity.status(201).body(FocusModeResponse.from(catalogService.createMode(command)));
    }

    @Operation(
            summary = "집중 세션 시작",
            description = """
                    이미 집중 중이면 기존 세션을 그대로 돌려주고 `alreadyActive`가 true가 된다. \
                    `durationMinutes`를 생략하면 `focus` 모드의 기본 시간을 쓴다.
                    """
    )
    @PostMapping("/start")
    public ResponseEntity<StartResult> start(@RequestBody StartFocusRequest request) {
        return ResponseEntity.ok(lifecycleService.start(request.userId(), request.durationMinutes()));
    }

    @Operation(summary = "집중 세션 종료", description = "진행 중인 세션이 없으면 `skipped`가 true로 반환된다.")
    @PostMapping("/stop")
    public ResponseEntity<FinalizeResult> stop(@RequestBody StopFocusRequest request) {
        return ResponseEntity.ok(lifecycleService.stop(request.userId()));
    }

    @Operation(summary = "모드 변경", description = "idle, break, meeting, sleep 중 하나. focus는 세션 시작과 같다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "변경 또는 동일 모드(`unchanged`)"),
            @ApiResponse(responseCode = "400", description = "지원하지 않는 모드 – code 값이 `mode.unsupported_mode`")
    })
    @PostMapping("/set")
    public ResponseEntity<SetModeResult> setMode(@RequestBody SetModeRequest request) {
        return ResponseEntity.ok(lifecycleService.setMode(request.userId(), request.mode()));
    }

    @Operation(summary = "현재 모드 조회")
    @GetMapping("/current/{userId}")
    public ResponseEntity<ModeStateView> currentMode(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(lifecycleService.getCurrentMode(userId));
    }

    @Operation(summary = "수신 메시지 처리", description = "집중 중이면 메시지를 차단하고 방해 횟수를 올린다.")
    @PostMapping("/message")
    public ResponseEntity<MessageHandlingResult> handleMessage(@RequestBody IncomingMessageRequest request) {
        return ResponseEntity.ok(lifecycleService.handleIncomingMessage(
                request.userId(),
                messageResolver.resolve(request.message())
        ));
    }

    @Operation(summary = "모드 요약 조회", description = "진행 중 세션, 최근 세션, 최근 7일 차단 메시지 수.")
    @GetMapping("/summary/{userId}")
    public ResponseEntity<ModeSummaryView> summary(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(lifecycleService.getSummary(userId));
    }
}

package com.alari.companion.controller;

import com.alari.companion.controller.dto.CheckInCreateRequestDto;
import com.alari.companion.controller.dto.CheckInListResponseDto;
import com.alari.companion.controller.dto.CheckInResponseDto;
import com.alari.companion.controller.dto.CheckInUpdateRequestDto;
import com.alari.companion.controller.dto.GoalCreateRequestDto;
import com.alari.companion.controller.dto.GoalListResponseDto;
import com.alari.companion.controller.dto.GoalResponseDto;
import com.alari.companion.controller.dto.GoalUpdateRequestDto;
import com.alari.companion.goal.GoalService;
import com.alari.companion.security.IdentityGate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/goals")
@Validated
public class GoalsController {

    private final GoalService goalService;
    private final IdentityGate identityGate;

    public GoalsController(GoalService goalService, IdentityGate identityGate) {
        this.goalService = goalService;
        this.identityGate = identityGate;
    }

    @PostMapping
    public ResponseEntity<GoalResponseDto> create(@Valid @RequestBody GoalCreateRequestDto request) {
        var goal = goalService.createGoal(identityGate.authenticate(), request.title(), request.description(), request.targetDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(GoalResponseDto.from(goal));
    }

    @GetMapping
    public GoalListResponseDto list(@RequestParam(value = "status", required = false) String status) {
        List<GoalResponseDto> goals = goalService.listGoals(identityGate.authenticate(), status).stream()
                .map(GoalResponseDto::from)
                .toList();
        return new GoalListResponseDto(goals, goals.size());
    }

    @GetMapping("/{goalId}")
    public GoalResponseDto get(@PathVariable("goalId") Long goalId) {
        return GoalResponseDto.from(goalService.getGoal(identityGate.authenticate(), goalId));
    }

    @PutMapping("/{goalId}")
    public GoalResponseDto update(@PathVariable("goalId") Long goalId, @Valid @RequestBody GoalUpdateRequestDto request) {
        var changes = new GoalService.GoalChanges(request.title(), request.description(), request.targetDate(), request.status());
        return GoalResponseDto.from(goalService.updateGoal(identityGate.authenticate(), goalId, changes));
    }

    @DeleteMapping("/{goalId}")
    public ResponseEntity<Void> delete(@PathVariable("goalId") Long goalId) {
        goalService.deleteGoal(identityGate.authenticate(), goalId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{goalId}/checkins")
    public ResponseEntity<CheckInResponseDto> createCheckIn(@PathVariable("goalId") Long goalId,
                                                            @RequestBody(required = false) CheckInCreateRequestDto request) {
        String note = request != null ? request.progressNote() : null;
        boolean completed = request != null && request.completedOrDefault();
        var checkIn = goalService.createCheckIn(identityGate.authenticate(), goalId, note, completed);
        return ResponseEntity.status(HttpStatus.CREATED).body(CheckInResponseDto.from(checkIn));
    }

    @GetMapping("/{goalId}/checkins")
    public CheckInListResponseDto listCheckIns(@PathVariable("goalId") Long goalId,
                                               @RequestParam(value = "limit", required = false) @Min(1) @Max(500) Integer limit) {
        List<CheckInResponseDto> checkIns = goalService.listCheckIns(identityGate.authenticate(), goalId, limit).stream()
                .map(CheckInResponseDto::from)
                .toList();
        return new CheckInListResponseDto(checkIns, checkIns.size());
    }

    @PutMapping("/{goalId}/checkins/{checkInId}")
    public CheckInResponseDto updateCheckIn(@PathVariable("goalId") Long goalId,
                                            @PathVariable("checkInId") Long checkInId,
                                            @RequestBody CheckInUpdateRequestDto request) {
        var changes = new GoalService.CheckInChanges(request.progressNote(), request.completed());
        return CheckInResponseDto.from(goalService.updateCheckIn(identityGate.authenticate(), goalId, checkInId, changes));
    }

    @DeleteMapping("/{goalId}/checkins/{checkInId}")
    public ResponseEntity<Void> deleteCheckIn(@PathVariable("goalId") Long goalId, @PathVariable("checkInId") Long checkInId) {
        goalService.deleteCheckIn(identityGate.authenticate(), goalId, checkInId);
        return ResponseEntity.noContent().build();
    }
}

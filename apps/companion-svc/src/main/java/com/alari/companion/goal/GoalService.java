package com.alari.companion.goal;

import com.alari.companion.security.Identity;
import com.alari.companion.security.OwnershipGuard;
import com.alari.companion.security.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class GoalService {
    private static final Logger log = LoggerFactory.getLogger(GoalService.class);

    public static final int DEFAULT_CHECK_IN_LIMIT = 30;
    static final int MAX_TITLE_LENGTH = 255;

    private final GoalRepository goalRepository;
    private final GoalCheckInRepository checkInRepository;
    private final OwnershipGuard ownershipGuard;
    private final Clock clock;

    @Autowired
    public GoalService(GoalRepository goalRepository, GoalCheckInRepository checkInRepository, OwnershipGuard ownershipGuard) {
        this(goalRepository, checkInRepository, ownershipGuard, Clock.systemUTC());
    }

    GoalService(GoalRepository goalRepository, GoalCheckInRepository checkInRepository, OwnershipGuard ownershipGuard, Clock clock) {
        this.goalRepository = goalRepository;
        this.checkInRepository = checkInRepository;
        this.ownershipGuard = ownershipGuard;
        this.clock = clock;
    }

    /** Partial update: null fields are left unchanged. */
    public record GoalChanges(String title, String description, Instant targetDate, String status) {}

    public record CheckInChanges(String progressNote, Boolean completed) {}

    @Transactional
    public GoalEntity createGoal(Identity identity, String title, String description, Instant targetDate) {
        GoalEntity saved = goalRepository.save(new GoalEntity(identity.id(), requireTitle(title), description, targetDate, now()));
        log.info("Goal {} created for user {}", saved.getId(), identity.id());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<GoalEntity> listGoals(Identity identity, String status) {
        if (status == null || status.isBlank()) {
            return goalRepository.findByUserIdOrderByCreatedAtDescIdDesc(identity.id());
        }
        return goalRepository.findByUserIdAndStatusOrderByCreatedAtDescIdDesc(identity.id(), GoalStatus.fromValue(status));
    }

    @Transactional(readOnly = true)
    public GoalEntity getGoal(Identity identity, Long goalId) {
        return authorize(identity, goalId);
    }

    @Transactional
    public GoalEntity updateGoal(Identity identity, Long goalId, GoalChanges changes) {
        GoalEntity goal = authorize(identity, goalId);
        // validate everything before touching the managed entity
        GoalStatus status = changes.status() != null ? GoalStatus.fromValue(changes.status()) : null;
        String title = changes.title() != null ? requireTitle(changes.title()) : null;
        if (title != null) {
            goal.setTitle(title);
        }
        if (changes.description() != null) {
            goal.setDescription(changes.description());
        }
        if (changes.targetDate() != null) {
            goal.setTargetDate(changes.targetDate());
        }
        if (status != null) {
            goal.setStatus(status);
        }
        goal.setUpdatedAt(now());
        return goalRepository.saveAndFlush(goal);
    }

    @Transactional
    public void deleteGoal(Identity identity, Long goalId) {
        GoalEntity goal = authorize(identity, goalId);
        int checkIns = checkInRepository.deleteByGoalId(goal.getId());
        goalRepository.deleteGoal(goal.getId());
        log.info("Goal {} deleted with {} check-ins", goal.getId(), checkIns);
    }

    /**
     * Records a check-in. A completed check-in bumps the goal's streak in the same transaction.
     */
    @Transactional
    public GoalCheckInEntity createCheckIn(Identity identity, Long goalId, String progressNote, boolean completed) {
        GoalEntity goal = authorize(identity, goalId);
        Instant now = now();
        GoalCheckInEntity saved = checkInRepository.saveAndFlush(new GoalCheckInEntity(goal.getId(), now, progressNote, completed));
        if (completed) {
            goalRepository.incrementStreak(goal.getId(), now);
        }
        return saved;
    }

    @Transactional(readOnly = true)
    public List<GoalCheckInEntity> listCheckIns(Identity identity, Long goalId, Integer limit) {
        GoalEntity goal = authorize(identity, goalId);
        int effective = limit == null ? DEFAULT_CHECK_IN_LIMIT : limit;
        if (effective <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return checkInRepository.findByGoalIdOrderByCheckInDateDescIdDesc(goal.getId(), PageRequest.of(0, effective));
    }

    /** Edits a check-in. Flipping {@code completed} here leaves the streak alone. */
    @Transactional
    public GoalCheckInEntity updateCheckIn(Identity identity, Long goalId, Long checkInId, CheckInChanges changes) {
        GoalCheckInEntity checkIn = requireCheckIn(authorize(identity, goalId), checkInId);
        if (changes.progressNote() != null) {
            checkIn.setProgressNote(changes.progressNote());
        }
        if (changes.completed() != null) {
            checkIn.setCompleted(changes.completed());
        }
        return checkInRepository.saveAndFlush(checkIn);
    }

    @Transactional
    public void deleteCheckIn(Identity identity, Long goalId, Long checkInId) {
        GoalCheckInEntity checkIn = requireCheckIn(authorize(identity, goalId), checkInId);
        checkInRepository.delete(checkIn);
    }

    private GoalEntity authorize(Identity identity, Long goalId) {
        Optional<GoalEntity> candidate = goalId == null ? Optional.empty() : goalRepository.findById(goalId);
        return ownershipGuard.authorize(identity, candidate).orElseThrow(ResourceNotFoundException::goal);
    }

    private GoalCheckInEntity requireCheckIn(GoalEntity goal, Long checkInId) {
        if (checkInId == null) {
            throw ResourceNotFoundException.checkIn();
        }
        return checkInRepository.findByIdAndGoalId(checkInId, goal.getId())
                .orElseThrow(ResourceNotFoundException::checkIn);
    }

    private static String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        return title;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}

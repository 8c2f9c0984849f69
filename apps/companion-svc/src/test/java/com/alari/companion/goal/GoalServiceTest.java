package com.alari.companion.goal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alari.companion.security.Identity;
import com.alari.companion.security.ResourceNotFoundException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class GoalServiceTest {

    @Autowired
    GoalService goalService;

    @Autowired
    GoalRepository goalRepository;

    @Autowired
    GoalCheckInRepository checkInRepository;

    private static Identity someone() {
        long id = ThreadLocalRandom.current().nextLong(1_000_000, Long.MAX_VALUE);
        return new Identity(id, "user" + id + "@example.com", null);
    }

    private int streakOf(Long goalId) {
        return goalRepository.findById(goalId).orElseThrow().getStreakCount();
    }

    @Test
    void newGoalStartsActiveWithNoStreak() {
        GoalEntity goal = goalService.createGoal(someone(), "Run 5k", "three times a week", Instant.parse("2025-12-31T00:00:00Z"));

        assertThat(goal.getStatus()).isEqualTo(GoalStatus.ACTIVE);
        assertThat(goal.getStreakCount()).isZero();
        assertThat(goal.getUpdatedAt()).isEqualTo(goal.getCreatedAt());
    }

    @Test
    void titleIsRequiredAndBounded() {
        Identity alice = someone();

        assertThatThrownBy(() -> goalService.createGoal(alice, " ", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> goalService.createGoal(alice, "x".repeat(256), null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(goalService.createGoal(alice, "x".repeat(255), null, null).getTitle()).hasSize(255);
    }

    @Test
    void completedCheckInExtendsStreak() {
        Identity alice = someone();
        GoalEntity goal = goalService.createGoal(alice, "Meditate", null, null);
        goalService.createCheckIn(alice, goal.getId(), "day 1", true);
        goalService.createCheckIn(alice, goal.getId(), "day 2", true);

        goalService.createCheckIn(alice, goal.getId(), "day 3", true);

        assertThat(streakOf(goal.getId())).isEqualTo(3);
    }

    @Test
    void incompleteCheckInLeavesStreak() {
        Identity alice = someone();
        GoalEntity goal = goalService.createGoal(alice, "Read", null, null);
        goalService.createCheckIn(alice, goal.getId(), "done", true);

        goalService.createCheckIn(alice, goal.getId(), "skipped", false);

        assertThat(streakOf(goal.getId())).isEqualTo(1);
    }

    @Test
    void editingCheckInDoesNotRecountStreak() {
        Identity alice = someone();
        GoalEntity goal = goalService.createGoal(alice, "Journal", null, null);
        GoalCheckInEntity checkIn = goalService.createCheckIn(alice, goal.getId(), null, false);

        GoalCheckInEntity updated = goalService.updateCheckIn(alice, goal.getId(), checkIn.getId(),
                new GoalService.CheckInChanges("caught up", true));

        assertThat(updated.isCompleted()).isTrue();
        assertThat(updated.getProgressNote()).isEqualTo("caught up");
        assertThat(streakOf(goal.getId())).isZero();
    }

    @Test
    void concurrentCheckInsAllCount() throws Exception {
        Identity alice = someone();
        GoalEntity goal = goalService.createGoal(alice, "Stretch", null, null);
        int attempts = 8;
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<GoalCheckInEntity>> tasks = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                tasks.add(() -> goalService.createCheckIn(alice, goal.getId(), null, true));
            }
            for (Future<GoalCheckInEntity> future : pool.invokeAll(tasks, 30, TimeUnit.SECONDS)) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(streakOf(goal.getId())).isEqualTo(attempts);
    }

    @Test
    void goalSaveDoesNotOverwriteStreak() {
        Identity alice = someone();
        GoalEntity goal = goalService.createGoal(alice, "Walk", null, null);
        goalService.createCheckIn(alice, goal.getId(), null, true);

        goalService.updateGoal(alice, goal.getId(), new GoalService.GoalChanges("Walk daily", null, null, "completed"));

        GoalEntity reloaded = goalRepository.findById(goal.getId()).orElseThrow();
        assertThat(reloaded.getTitle()).isEqualTo("Walk daily");
        assertThat(reloaded.getStatus()).isEqualTo(GoalStatus.COMPLETED);
        assertThat(reloaded.getStreakCount()).isEqualTo(1);
    }

    @Test
    void invalidStatusChangesNothing() {
        Identity alice = someone();
        GoalEntity goal = goalService.createGoal(alice, "Swim", null, null);

        assertThatThrownBy(() -> goalService.updateGoal(alice, goal.getId(),
                new GoalService.GoalChanges("Swim more", null, null, "paused")))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(goalRepository.findById(goal.getId()).orElseThrow().getTitle()).isEqualTo("Swim");
    }

    @Test
    void listFiltersByStatusNewestFirst() {
        Identity alice = someone();
        GoalEntity first = goalService.createGoal(alice, "first", null, null);
        GoalEntity second = goalService.createGoal(alice, "second", null, null);
        goalService.updateGoal(alice, first.getId(), new GoalService.GoalChanges(null, null, null, "abandoned"));

        assertThat(goalService.listGoals(alice, null)).extracting(GoalEntity::getId)
                .containsExactly(second.getId(), first.getId());
        assertThat(goalService.listGoals(alice, "abandoned")).extracting(GoalEntity::getId)
                .containsExactly(first.getId());
        assertThatThrownBy(() -> goalService.listGoals(alice, "paused")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void checkInsAreListedNewestFirstWithLimit() {
        Identity alice = someone();
        GoalEntity goal = goalService.createGoal(alice, "Sleep early", null, null);
        goalService.createCheckIn(alice, goal.getId(), "one", false);
        goalService.createCheckIn(alice, goal.getId(), "two", false);
        goalService.createCheckIn(alice, goal.getId(), "three", false);

        assertThat(goalService.listCheckIns(alice, goal.getId(), 2))
                .extracting(GoalCheckInEntity::getProgressNote)
                .containsExactly("three", "two");
        assertThatThrownBy(() -> goalService.listCheckIns(alice, goal.getId(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void checkInMustBelongToAddressedGoal() {
        Identity alice = someone();
        GoalEntity goalA = goalService.createGoal(alice, "A", null, null);
        GoalEntity goalB = goalService.createGoal(alice, "B", null, null);
        GoalCheckInEntity checkIn = goalService.createCheckIn(alice, goalA.getId(), null, false);

        assertThatThrownBy(() -> goalService.deleteCheckIn(alice, goalB.getId(), checkIn.getId()))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Check-in not found");
        assertThat(checkInRepository.findById(checkIn.getId())).isPresent();
    }

    @Test
    void otherUsersGoalIsNotFound() {
        Identity alice = someone();
        Identity bob = someone();
        GoalEntity goal = goalService.createGoal(alice, "Private", null, null);

        assertThatThrownBy(() -> goalService.getGoal(bob, goal.getId()))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Goal not found");
        assertThatThrownBy(() -> goalService.createCheckIn(bob, goal.getId(), null, true))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(streakOf(goal.getId())).isZero();
    }

    @Test
    void deletingGoalRemovesCheckIns() {
        Identity alice = someone();
        GoalEntity goal = goalService.createGoal(alice, "Temporary", null, null);
        GoalCheckInEntity checkIn = goalService.createCheckIn(alice, goal.getId(), null, true);

        goalService.deleteGoal(alice, goal.getId());

        assertThat(goalRepository.findById(goal.getId())).isEmpty();
        assertThat(checkInRepository.findById(checkIn.getId())).isEmpty();
    }
}

package com.alari.companion.goal;

import com.alari.companion.security.OwnedResource;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "goals")
public class GoalEntity implements OwnedResource {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "target_date")
    private Instant targetDate;

    @Column(name = "status", nullable = false, length = 50)
    private GoalStatus status;

    // excluded from entity updates; only GoalRepository.incrementStreak writes it
    @Column(name = "streak_count", nullable = false, updatable = false)
    private int streakCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected GoalEntity() {}

    public GoalEntity(Long userId, String title, String description, Instant targetDate, Instant createdAt) {
        this.userId = userId;
        this.title = title;
        this.description = description;
        this.targetDate = targetDate;
        this.status = GoalStatus.ACTIVE;
        this.streakCount = 0;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public Long getId() { return id; }
    @Override
    public Long getUserId() { return userId; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public Instant getTargetDate() { return targetDate; }
    public GoalStatus getStatus() { return status; }
    public int getStreakCount() { return streakCount; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setTitle(String title) { this.title = title; }
    public void setDescription(String description) { this.description = description; }
    public void setTargetDate(Instant targetDate) { this.targetDate = targetDate; }
    public void setStatus(GoalStatus status) { this.status = status; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}

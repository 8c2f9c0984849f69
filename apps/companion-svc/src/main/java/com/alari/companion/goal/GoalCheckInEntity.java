package com.alari.companion.goal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "goal_check_ins")
public class GoalCheckInEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "goal_id", nullable = false, updatable = false)
    private Long goalId;

    @Column(name = "check_in_date", nullable = false, updatable = false)
    private Instant checkInDate;

    @Column(name = "progress_note", columnDefinition = "text")
    private String progressNote;

    @Column(name = "completed", nullable = false)
    private boolean completed;

    protected GoalCheckInEntity() {}

    public GoalCheckInEntity(Long goalId, Instant checkInDate, String progressNote, boolean completed) {
        this.goalId = goalId;
        this.checkInDate = checkInDate;
        this.progressNote = progressNote;
        this.completed = completed;
    }

    public Long getId() { return id; }
    public Long getGoalId() { return goalId; }
    public Instant getCheckInDate() { return checkInDate; }
    public String getProgressNote() { return progressNote; }
    public boolean isCompleted() { return completed; }

    public void setProgressNote(String progressNote) { this.progressNote = progressNote; }
    public void setCompleted(boolean completed) { this.completed = completed; }
}

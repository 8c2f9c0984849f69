package com.alari.companion.goal;

import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface GoalRepository extends JpaRepository<GoalEntity, Long> {
    List<GoalEntity> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    List<GoalEntity> findByUserIdAndStatusOrderByCreatedAtDescIdDesc(Long userId, GoalStatus status);

    /** Read-modify-write happens inside the database so concurrent check-ins never lose an increment. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update GoalEntity g set g.streakCount = g.streakCount + 1, g.updatedAt = :updatedAt where g.id = :goalId")
    int incrementStreak(@Param("goalId") Long goalId, @Param("updatedAt") Instant updatedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from GoalEntity g where g.id = :goalId")
    int deleteGoal(@Param("goalId") Long goalId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from GoalEntity g where g.userId = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}

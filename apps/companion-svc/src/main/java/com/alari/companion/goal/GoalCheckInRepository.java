package com.alari.companion.goal;

import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface GoalCheckInRepository extends JpaRepository<GoalCheckInEntity, Long> {
    List<GoalCheckInEntity> findByGoalIdOrderByCheckInDateDescIdDesc(Long goalId, Pageable pageable);

    Optional<GoalCheckInEntity> findByIdAndGoalId(Long id, Long goalId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from GoalCheckInEntity c where c.goalId = :goalId")
    int deleteByGoalId(@Param("goalId") Long goalId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from GoalCheckInEntity c where c.goalId in "
            + "(select g.id from GoalEntity g where g.userId = :userId)")
    int deleteByGoalOwner(@Param("userId") Long userId);
}

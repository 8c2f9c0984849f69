package com.alari.companion.user;

import com.alari.companion.conversation.ConversationRepository;
import com.alari.companion.conversation.MessageRepository;
import com.alari.companion.goal.GoalCheckInRepository;
import com.alari.companion.goal.GoalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Removes an account and everything it owns. Children go first, in one transaction.
 */
@Service
public class UserDeletionService {

    private static final Logger log = LoggerFactory.getLogger(UserDeletionService.class);

    private final MessageRepository messageRepository;
    private final ConversationRepository conversationRepository;
    private final GoalCheckInRepository checkInRepository;
    private final GoalRepository goalRepository;
    private final UserRepository userRepository;

    public UserDeletionService(
            MessageRepository messageRepository,
            ConversationRepository conversationRepository,
            GoalCheckInRepository checkInRepository,
            GoalRepository goalRepository,
            UserRepository userRepository
    ) {
        this.messageRepository = messageRepository;
        this.conversationRepository = conversationRepository;
        this.checkInRepository = checkInRepository;
        this.goalRepository = goalRepository;
        this.userRepository = userRepository;
    }

    @Transactional
    public void deleteUser(Long userId) {
        int messages = messageRepository.deleteByConversationOwner(userId);
        int conversations = conversationRepository.deleteByUserId(userId);
        int checkIns = checkInRepository.deleteByGoalOwner(userId);
        int goals = goalRepository.deleteByUserId(userId);

        try {
            userRepository.deleteById(userId);
        } catch (EmptyResultDataAccessException ex) {
            log.debug("User {} already deleted, continuing cleanup", userId);
        }
        log.info("Deleted user {}: {} conversations, {} messages, {} goals, {} check-ins",
                userId, conversations, messages, goals, checkIns);
    }
}

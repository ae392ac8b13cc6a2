package com.mockinterview.platform.repository;

import com.mockinterview.platform.model.ConversationMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, String> {

    List<ConversationMessage> findBySessionIdOrderBySequenceAsc(String sessionId);

    Optional<ConversationMessage> findFirstBySessionIdOrderBySequenceDesc(String sessionId);

    void deleteBySessionId(String sessionId);
}

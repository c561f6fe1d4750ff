package com.groceryshopper.chat.repository;

import com.groceryshopper.chat.domain.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    /**
     * Newest messages first; callers reverse for chronological display
     */
    @Query("SELECT m FROM ChatMessage m WHERE m.roomId = :roomId ORDER BY m.createdAt DESC, m.id DESC")
    List<ChatMessage> findRecentByRoomId(@Param("roomId") Long roomId, Pageable pageable);
}

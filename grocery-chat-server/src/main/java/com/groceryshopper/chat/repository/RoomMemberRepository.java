package com.groceryshopper.chat.repository;

import com.groceryshopper.chat.domain.RoomMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface RoomMemberRepository extends JpaRepository<RoomMember, Long> {

    /**
     * Active (not soft-deleted) membership check
     */
    @Query("SELECT COUNT(m) > 0 FROM RoomMember m " +
           "WHERE m.roomId = :roomId AND m.userId = :userId AND m.deletedAt IS NULL")
    boolean isActiveMember(@Param("roomId") Long roomId, @Param("userId") Long userId);
}

package com.groceryshopper.chat.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Room membership. Rows with a {@code deletedAt} are soft-deleted and grant no access.
 */
@Entity
@Table(name = "room_members", indexes = {
    @Index(name = "idx_room_members_deleted_at", columnList = "room_id,deleted_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(columnDefinition = "INT")
    private Long id;

    @Column(name = "room_id", nullable = false, columnDefinition = "INT")
    private Long roomId;

    @Column(name = "user_id", nullable = false, columnDefinition = "INT")
    private Long userId;

    @Column(name = "joined_at", insertable = false, updatable = false)
    private Instant joinedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;
}

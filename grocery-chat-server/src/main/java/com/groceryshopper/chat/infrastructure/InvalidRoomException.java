package com.groceryshopper.chat.infrastructure;

/**
 * Subscribe target is not a positive room id.
 */
public class InvalidRoomException extends RuntimeException {

    private final Long roomId;

    public InvalidRoomException(Long roomId) {
        super("Invalid room id: " + roomId);
        this.roomId = roomId;
    }

    public Long getRoomId() {
        return roomId;
    }
}

package com.keer.seating.guest.model;

public enum CheckInStatus {
    NOT_ARRIVED, CHECKED_IN
}

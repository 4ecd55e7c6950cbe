package com.clinic.prescription_service.util;

public class Constants {

    private Constants() {
        // Utility class, no instantiation
    }

    public static final String SERVICE_NAME = "prescription-service";

    // Appointment Constants
    public static final String APPOINTMENT_STATUS_COMPLETED = "COMPLETED";

    // Notification Constants
    public static final String EVENT_PRESCRIPTION_CREATED = "prescription_created";

    // Pagination Constants
    public static final String DEFAULT_SKIP = "0";
    public static final String DEFAULT_LIMIT = "100";
    public static final int MAX_LIMIT = 100;
}

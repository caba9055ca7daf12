package com.platform.reconciler.notify;

public enum NotificationLevel {
    DEBUG(7),
    INFO(6),
    SUCCESS(6),
    WARNING(4),
    ERROR(3),
    CRITICAL(2);
    
    private final int journalPriority;
    
    NotificationLevel(int journalPriority) {
        this.journalPriority = journalPriority;
    }
    
    /**
     * syslog priority used when writing to the journal.
     */
    public int journalPriority() {
        return journalPriority;
    }
}

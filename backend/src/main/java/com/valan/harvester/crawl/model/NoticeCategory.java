package com.valan.harvester.crawl.model;

public enum NoticeCategory {
    TENDER,
    AWARD
}

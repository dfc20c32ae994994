package com.memoryfetch.memoryfetch.memories;

/**
 * Shared constants for the memories download flow.
 */
public final class MemoriesConstants {

    private MemoriesConstants() {
    }

    public static final String DEFAULT_OUTPUT_DIR = "downloads";
    public static final double DEFAULT_DELAY_SECONDS = 1.0;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_CONCURRENCY = 1;
    public static final int DEFAULT_CONFIRM_CONCURRENCY_ABOVE = 10;
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    public static final String DEFAULT_ROUTE_HEADER_NAME = "X-Snap-Route-Tag";
    public static final String DEFAULT_ROUTE_HEADER_VALUE = "mem-dmd";

    public static final String IMAGES_DIR = "images";
    public static final String VIDEOS_DIR = "videos";
    public static final String STATE_FILE_NAME = "download_state.json";
    public static final String FAILURE_LOG_FILE_NAME = "failed_downloads.log";
    public static final String PART_EXTENSION = ".part";
    public static final String UNWRAP_TEMP_PREFIX = "temp_";

    public static final String SID_PARAMETER = "sid";
    public static final int UNIQUE_PART_LENGTH = 16;
    public static final String UNKNOWN_DATE = "unknown_date";
    public static final String TIMESTAMP_UTC_SUFFIX = " UTC";
    public static final String INPUT_TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";
    public static final String FILE_TIMESTAMP_PATTERN = "yyyy-MM-dd_HH-mm-ss";

    public static final String EXT_VIDEO = "mp4";
    public static final String EXT_IMAGE = "jpg";
    public static final String EXT_UNKNOWN = "bin";
    public static final String MAIN_IMAGE_SUFFIX = "-main.jpg";
    public static final String MAIN_VIDEO_SUFFIX = "-main.mp4";

    public static final int MIN_TABLE_CELLS = 4;
    public static final int CELL_TIMESTAMP = 0;
    public static final int CELL_MEDIA_KIND = 1;
    public static final int CELL_DIRECTIVE = 3;
    public static final String DIRECTIVE_REGEX = "downloadMemories\\('(.+?)',\\s*this,\\s*(true|false)\\)";

    public static final String MSG_EXPORT_NOT_FOUND = "Export file not found: %s";
    public static final String MSG_EXPORT_NOT_READABLE = "Export file is not readable: %s";
    public static final String MSG_EXPORT_READ_FAILED = "Failed to read export file: %s";
    public static final String MSG_INVALID_CONCURRENCY = "Concurrency must be at least 1 but was %d";
    public static final String MSG_INVALID_MAX_RETRIES = "Max retries must be at least 1 but was %d";
    public static final String MSG_INVALID_DELAY = "Delay must not be negative but was %s";
    public static final String MSG_EMPTY_PAYLOAD = "Downloaded file is empty";
    public static final String MSG_HTTP_STATUS = "%s %s returned HTTP %d";
    public static final String MSG_BLANK_REDIRECT = "POST %s returned no download URL";
    public static final String MSG_INVALID_URL = "Invalid URL: %s";
    public static final String MSG_FAILED_AFTER_ATTEMPTS = "Failed after %d attempts: %s";
}

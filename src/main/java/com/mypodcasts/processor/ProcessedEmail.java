package com.mypodcasts.processor;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;

/**
 * Speech ready text of one newsletter with its filing metadata.
 */
public final class ProcessedEmail {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    /**
     * Calendar date YYYY-MM-DD or 9999-12-31.
     */
    @SerializedName("date")
    private final String date;

    /**
     * Subject slug.
     */
    @SerializedName("subject")
    private final String subject;

    /**
     * Decoded subject.
     */
    @SerializedName("subject_raw")
    private final String subjectRaw;

    /**
     * Speech ready body.
     */
    @SerializedName("body")
    private final String body;

    /**
     * Constructs a new ProcessedEmail instance.
     *
     * @param date       Date string.
     * @param subject    Subject slug.
     * @param subjectRaw Decoded subject.
     * @param body       Body text.
     */
    public ProcessedEmail(String date, String subject, String subjectRaw, String body) {
        this.date = date;
        this.subject = subject;
        this.subjectRaw = subjectRaw;
        this.body = body;
    }

    /**
     * Gets date.
     *
     * @return Date string.
     */
    public String getDate() {
        return date;
    }

    /**
     * Gets subject slug.
     *
     * @return Slug string.
     */
    public String getSubject() {
        return subject;
    }

    /**
     * Gets decoded subject.
     *
     * @return Subject string.
     */
    public String getSubjectRaw() {
        return subjectRaw;
    }

    /**
     * Gets body.
     *
     * @return Body string.
     */
    public String getBody() {
        return body;
    }

    /**
     * Gets the file name stem shared by text files and episodes.
     *
     * @return <i>date-slug</i> string.
     */
    public String getStem() {
        return date + "-" + subject;
    }

    /**
     * Renders as pretty printed JSON.
     *
     * @return JSON string.
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    @Override
    public String toString() {
        return "ProcessedEmail{date=" + date + ", subject=" + subject + ", body=" + body.length() + " chars}";
    }
}

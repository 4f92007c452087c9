package com.notifica.emisor.dto;

import java.util.ArrayList;
import java.util.List;

public class EmissionRunSummary {
    private String sessionId;
    private String state;
    private int totalInputRecords;
    private int totalUniqueAccounts;
    private int matchedAndProcessed; // distinct matched accounts
    private int pdfsGenerated;
    private int failedRecords;
    private List<String> unmatchedAccounts = new ArrayList<>();
    private List<String> errors = new ArrayList<>(); // first N only
    private double elapsedSeconds;
    private double throughputPdfsPerSecond;
    private String outputPath;
    private String unmatchedReportPath;
    private String pmoLabel;
    private Integer pmoSequence;

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public String getState() { return state; }
    public void setState(String state) { this.state = state; }
    public int getTotalInputRecords() { return totalInputRecords; }
    public void setTotalInputRecords(int totalInputRecords) { this.totalInputRecords = totalInputRecords; }
    public int getTotalUniqueAccounts() { return totalUniqueAccounts; }
    public void setTotalUniqueAccounts(int totalUniqueAccounts) { this.totalUniqueAccounts = totalUniqueAccounts; }
    public int getMatchedAndProcessed() { return matchedAndProcessed; }
    public void setMatchedAndProcessed(int matchedAndProcessed) { this.matchedAndProcessed = matchedAndProcessed; }
    public int getPdfsGenerated() { return pdfsGenerated; }
    public void setPdfsGenerated(int pdfsGenerated) { this.pdfsGenerated = pdfsGenerated; }
    public int getFailedRecords() { return failedRecords; }
    public void setFailedRecords(int failedRecords) { this.failedRecords = failedRecords; }
    public List<String> getUnmatchedAccounts() { return unmatchedAccounts; }
    public void setUnmatchedAccounts(List<String> unmatchedAccounts) { this.unmatchedAccounts = unmatchedAccounts; }
    public List<String> getErrors() { return errors; }
    public void setErrors(List<String> errors) { this.errors = errors; }
    public double getElapsedSeconds() { return elapsedSeconds; }
    public void setElapsedSeconds(double elapsedSeconds) { this.elapsedSeconds = elapsedSeconds; }
    public double getThroughputPdfsPerSecond() { return throughputPdfsPerSecond; }
    public void setThroughputPdfsPerSecond(double throughputPdfsPerSecond) { this.throughputPdfsPerSecond = throughputPdfsPerSecond; }
    public String getOutputPath() { return outputPath; }
    public void setOutputPath(String outputPath) { this.outputPath = outputPath; }
    public String getUnmatchedReportPath() { return unmatchedReportPath; }
    public void setUnmatchedReportPath(String unmatchedReportPath) { this.unmatchedReportPath = unmatchedReportPath; }
    public String getPmoLabel() { return pmoLabel; }
    public void setPmoLabel(String pmoLabel) { this.pmoLabel = pmoLabel; }
    public Integer getPmoSequence() { return pmoSequence; }
    public void setPmoSequence(Integer pmoSequence) { this.pmoSequence = pmoSequence; }
}

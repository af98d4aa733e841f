package com.di.modelops.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * SQL queries loaded from sql-queries.yml (modelops.sql.*).
 * No SQL is hardcoded in JDBC store classes; they use these named queries.
 */
@Component
@ConfigurationProperties(prefix = "modelops.sql")
public class SqlQueriesProperties {

    private Schema schema = new Schema();
    private Source source = new Source();
    private Snapshot snapshot = new Snapshot();
    private Jobs jobs = new Jobs();
    private Audit audit = new Audit();

    public Schema getSchema() { return schema; }
    public void setSchema(Schema schema) { this.schema = schema; }
    public Source getSource() { return source; }
    public void setSource(Source source) { this.source = source; }
    public Snapshot getSnapshot() { return snapshot; }
    public void setSnapshot(Snapshot snapshot) { this.snapshot = snapshot; }
    public Jobs getJobs() { return jobs; }
    public void setJobs(Jobs jobs) { this.jobs = jobs; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }

    /** Idempotent DDL, run in order: create-if-absent, additive columns, backfill, indexes. */
    public static class Schema {
        private List<String> statements = new ArrayList<>();
        public List<String> getStatements() { return statements; }
        public void setStatements(List<String> statements) { this.statements = statements; }
    }

    /** Read-only queries against the prediction/match tables owned by the ingestion pipeline. */
    public static class Source {
        private String evaluatedMetrics;
        private String latestGameDate;
        private String latestPipelineSync;
        private String completedItems;
        public String getEvaluatedMetrics() { return evaluatedMetrics; }
        public void setEvaluatedMetrics(String evaluatedMetrics) { this.evaluatedMetrics = evaluatedMetrics; }
        public String getLatestGameDate() { return latestGameDate; }
        public void setLatestGameDate(String latestGameDate) { this.latestGameDate = latestGameDate; }
        public String getLatestPipelineSync() { return latestPipelineSync; }
        public void setLatestPipelineSync(String latestPipelineSync) { this.latestPipelineSync = latestPipelineSync; }
        public String getCompletedItems() { return completedItems; }
        public void setCompletedItems(String completedItems) { this.completedItems = completedItems; }
    }

    public static class Snapshot {
        private String insert;
        private String findRecent;
        private String findWithinDays;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindRecent() { return findRecent; }
        public void setFindRecent(String findRecent) { this.findRecent = findRecent; }
        public String getFindWithinDays() { return findWithinDays; }
        public void setFindWithinDays(String findWithinDays) { this.findWithinDays = findWithinDays; }
    }

    public static class Jobs {
        private String insert;
        private String findById;
        private String findRecentActive;
        private String findActiveByCohort;
        private String claimCandidates;
        private String claimCandidatesByCohort;
        private String markRunning;
        private String finalizeRunning;
        private String listByCohort;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindById() { return findById; }
        public void setFindById(String findById) { this.findById = findById; }
        public String getFindRecentActive() { return findRecentActive; }
        public void setFindRecentActive(String findRecentActive) { this.findRecentActive = findRecentActive; }
        public String getFindActiveByCohort() { return findActiveByCohort; }
        public void setFindActiveByCohort(String findActiveByCohort) { this.findActiveByCohort = findActiveByCohort; }
        public String getClaimCandidates() { return claimCandidates; }
        public void setClaimCandidates(String claimCandidates) { this.claimCandidates = claimCandidates; }
        public String getClaimCandidatesByCohort() { return claimCandidatesByCohort; }
        public void setClaimCandidatesByCohort(String claimCandidatesByCohort) { this.claimCandidatesByCohort = claimCandidatesByCohort; }
        public String getMarkRunning() { return markRunning; }
        public void setMarkRunning(String markRunning) { this.markRunning = markRunning; }
        public String getFinalizeRunning() { return finalizeRunning; }
        public void setFinalizeRunning(String finalizeRunning) { this.finalizeRunning = finalizeRunning; }
        public String getListByCohort() { return listByCohort; }
        public void setListByCohort(String listByCohort) { this.listByCohort = listByCohort; }
    }

    public static class Audit {
        private String insert;
        private String findRecentByModule;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindRecentByModule() { return findRecentByModule; }
        public void setFindRecentByModule(String findRecentByModule) { this.findRecentByModule = findRecentByModule; }
    }
}

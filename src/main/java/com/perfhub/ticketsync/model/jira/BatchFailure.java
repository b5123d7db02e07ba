package com.perfhub.ticketsync.model.jira;

/**
 * A bulk detail batch that could not be fetched; its issues are absent from the run.
 *
 * @param batchNumber 1-based batch number
 * @param firstIndex  index of the batch's first identifier in the collected id list
 * @param size        number of identifiers in the batch
 */
public record BatchFailure(int batchNumber, int firstIndex, int size, String reason) {
}

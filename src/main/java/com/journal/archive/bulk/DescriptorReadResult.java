package com.journal.archive.bulk;

import com.journal.archive.descriptor.EntryDescriptor;

import java.util.List;

/**
 * Result of reading entry descriptors from a bulk input.
 *
 * @param descriptors descriptors that parsed cleanly, in input order
 * @param errors      records that could not be turned into a descriptor
 */
public record DescriptorReadResult(List<EntryDescriptor> descriptors, List<ReadError> errors) {

    public DescriptorReadResult {
        descriptors = descriptors != null ? List.copyOf(descriptors) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param recordNumber 1-based position of the record in the input, 0 for input-level failures
     */
    public record ReadError(long recordNumber, String message) {
    }
}

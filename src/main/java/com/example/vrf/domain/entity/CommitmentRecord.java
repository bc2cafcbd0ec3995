package com.example.vrf.domain.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Published (or attempted) commitment to a seed. The transaction fields are
 * null when the upload did not complete; {@code encrypted} is then omitted.
 */
public record CommitmentRecord(
    @JsonProperty("commitment_hash") String commitmentHash,
    @JsonProperty("storage_tx_id") String storageTxId,
    @JsonProperty("storage_url") String storageUrl,
    @JsonInclude(JsonInclude.Include.NON_NULL) Boolean encrypted
) {

  public static CommitmentRecord unpublished(String commitmentHash) {
    return new CommitmentRecord(commitmentHash, null, null, null);
  }

  public boolean published() {
    return storageTxId != null;
  }
}

package com.depositpool.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Counter document backing PoolAddress.poolSeq.
 */
@Document(collection = "pool_sequences")
@NoArgsConstructor
@Getter
@Setter
public class PoolSequence {

    public static final String POOL_ADDRESS_SEQ = "pool_address";

    @Id
    private String id;
    private long value;
}

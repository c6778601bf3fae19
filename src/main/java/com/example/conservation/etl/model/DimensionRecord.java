package com.example.conservation.etl.model;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public abstract class DimensionRecord extends ConformedRecord {

    /** Stable surrogate key, assigned once per natural key and never reused. */
    private long surrogateKey;
}

package uk.investir.cgt.core.model;

import lombok.Value;

@Value
public class Security {
    String isin;
    String name;
}

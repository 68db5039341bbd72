package uk.investir.cgt.core.model;

import lombok.Value;

@Value
public class OrderSplit<T extends Order> {
    T match;
    T remainder;
}

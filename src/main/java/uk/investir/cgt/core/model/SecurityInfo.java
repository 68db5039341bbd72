package uk.investir.cgt.core.model;

import lombok.Value;

import java.util.List;

@Value
public class SecurityInfo {
    String name;
    List<Split> splits;

    public static SecurityInfo unknown(String name) {
        return new SecurityInfo(name, List.of());
    }
}

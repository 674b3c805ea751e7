package org.crash.service.crash.util;

import org.springframework.stereotype.Component;

import java.util.Objects;

/** Moniteurs striped par wallet : deux opérations d'un même wallet ne s'entrelacent jamais. */
@Component
public class Locks {
    private final Object[] stripes = new Object[128];
    public Locks() { for (int i=0;i<stripes.length;i++) stripes[i] = new Object(); }
    public Object of(String walletAddress) {
        int idx = Objects.hashCode(walletAddress) & (stripes.length - 1);
        return stripes[idx];
    }
}

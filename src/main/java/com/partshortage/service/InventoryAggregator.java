package com.partshortage.service;

import com.partshortage.domain.InventorySnapshot;
import com.partshortage.domain.PartKey;
import com.partshortage.domain.StockQuantity;
import com.partshortage.support.ZeroDefaultLookup;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Supply-side view per part over the three inventory sources. No netting against demand.
 */
@Service
public class InventoryAggregator {

    public Sources aggregate(List<StockQuantity> onHand, List<StockQuantity> theoretical, List<StockQuantity> external) {
        return new Sources(
            ZeroDefaultLookup.summing(onHand, StockQuantity::part, StockQuantity::quantity),
            ZeroDefaultLookup.summing(theoretical, StockQuantity::part, StockQuantity::quantity),
            ZeroDefaultLookup.summing(external, StockQuantity::part, StockQuantity::quantity));
    }

    public record Sources(
        ZeroDefaultLookup<PartKey> onHand,
        ZeroDefaultLookup<PartKey> theoretical,
        ZeroDefaultLookup<PartKey> external
    ) {

        public InventorySnapshot snapshot(PartKey part) {
            return new InventorySnapshot(part, onHand.get(part), theoretical.get(part), external.get(part));
        }

        public double totalAvailable(PartKey part) {
            return snapshot(part).totalAvailable();
        }
    }
}

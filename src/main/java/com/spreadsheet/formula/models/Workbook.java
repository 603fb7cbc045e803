package com.spreadsheet.formula.models;

import com.spreadsheet.formula.address.CellAddress;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents one open document:
 * - Has a unique ID and the name of the sheet unqualified addresses belong to
 * - A map of cell position -> CellRecord (positions are sheet-qualified and carry no '$' anchors)
 * - Two dependency graphs (forward, reverse) to track references
 * - The positions of cleared cells that other formulas still reference
 * - A read/write lock for concurrency
 */
public class Workbook {

    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final String defaultSheetName;
    private final Map<CellAddress, CellRecord> cells = new ConcurrentHashMap<>();

    // Forward adjacency: formula cell -> cells it references
    private final Map<CellAddress, Set<CellAddress>> dependencyGraphForward = new ConcurrentHashMap<>();
    // Reverse adjacency: referenced cell -> formula cells referencing it
    private final Map<CellAddress, Set<CellAddress>> dependencyGraphReverse = new ConcurrentHashMap<>();

    private final Set<CellAddress> clearedCells = ConcurrentHashMap.newKeySet();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Workbook(String defaultSheetName) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.defaultSheetName = defaultSheetName;
    }

    public long getId() {
        return id;
    }

    public String getDefaultSheetName() {
        return defaultSheetName;
    }

    public Map<CellAddress, CellRecord> getCells() {
        return cells;
    }

    public void setCell(CellRecord cell) {
        cells.put(cell.getAddress(), cell);
        clearedCells.remove(cell.getAddress());
    }

    public CellRecord getCell(CellAddress position) {
        return cells.get(position);
    }

    public CellRecord removeCell(CellAddress position) {
        return cells.remove(position);
    }

    /**
     * Remembers that a referenced cell was cleared, until it is written again or nothing references it.
     */
    public void markCleared(CellAddress position) {
        clearedCells.add(position);
    }

    public boolean isCleared(CellAddress position) {
        return clearedCells.contains(position);
    }

    public void forgetCleared(CellAddress position) {
        clearedCells.remove(position);
    }

    // ------------------------
    // Dependency Management
    // ------------------------

    /**
     * Adds a reference from 'source' -> 'target' in the forward graph,
     * and the reverse graph from 'target' -> 'source'.
     */
    public void addDependency(CellAddress source, CellAddress target) {
        dependencyGraphForward
                .computeIfAbsent(source, k -> new HashSet<>())
                .add(target);
        dependencyGraphReverse
                .computeIfAbsent(target, k -> new HashSet<>())
                .add(source);
    }

    /**
     * Removes all forward references from 'source', and also removes 'source'
     * from each target's reverse references. Returns the targets it used to reference.
     */
    public Set<CellAddress> clearDependencies(CellAddress source) {
        Set<CellAddress> oldTargets = dependencyGraphForward.remove(source);
        if (oldTargets == null) {
            return Collections.emptySet();
        }
        for (CellAddress target : oldTargets) {
            Set<CellAddress> referencedBy = dependencyGraphReverse.get(target);
            if (referencedBy != null) {
                referencedBy.remove(source);
                if (referencedBy.isEmpty()) {
                    dependencyGraphReverse.remove(target);
                }
            }
        }
        return oldTargets;
    }

    public Set<CellAddress> getDependencies(CellAddress position) {
        return dependencyGraphForward.getOrDefault(position, Collections.emptySet());
    }

    public Set<CellAddress> getDependents(CellAddress position) {
        return dependencyGraphReverse.getOrDefault(position, Collections.emptySet());
    }

    // Basic getters for the adjacency maps
    public Map<CellAddress, Set<CellAddress>> getForwardGraph() {
        return dependencyGraphForward;
    }
    public Map<CellAddress, Set<CellAddress>> getReverseGraph() {
        return dependencyGraphReverse;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}

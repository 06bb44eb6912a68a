package com.chronoplan.core.scheduler;

import com.chronoplan.core.model.CapacityConflict;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ProjectAllocation;
import com.chronoplan.core.model.ProjectStatus;
import com.chronoplan.core.model.ResourceAvailability;
import com.chronoplan.core.model.ResourcePoolItem;
import com.chronoplan.core.model.ResourceRequirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Portfolio-level capacity checks: project resource requirements summed per calendar month
 * against pool capacity.
 * <p>
 * A project claims {@code count} units of each required resource in every month its date
 * range touches. Completed and cancelled projects claim nothing.
 */
@Service
public class CapacityPlanner {

    private static final Logger log = LoggerFactory.getLogger(CapacityPlanner.class);

    /**
     * Months in which the summed requirements of overlapping projects exceed a resource's capacity.
     * The months scanned run from the earliest start to the latest end of the claiming projects.
     *
     * @return conflicts grouped by resource in pool order, then by month
     */
    public List<CapacityConflict> detectCapacityConflicts(List<Project> projects, List<ResourcePoolItem> resourcePool) {
        List<Project> claiming = projects.stream().filter(CapacityPlanner::claimsCapacity).toList();
        if (claiming.isEmpty() || resourcePool.isEmpty()) {
            return List.of();
        }
        YearMonth first = claiming.stream().map(p -> YearMonth.from(p.startDate()))
                .min(Comparator.naturalOrder()).orElseThrow();
        YearMonth last = claiming.stream().map(p -> YearMonth.from(p.endDate()))
                .max(Comparator.naturalOrder()).orElseThrow();

        var conflicts = new ArrayList<CapacityConflict>();
        for (ResourcePoolItem resource : resourcePool) {
            for (YearMonth month = first; !month.isAfter(last); month = month.plusMonths(1)) {
                List<ProjectAllocation> allocations = allocations(resource.id(), month, claiming);
                int allocated = allocations.stream().mapToInt(ProjectAllocation::allocation).sum();
                if (allocated > resource.totalQuantity()) {
                    conflicts.add(new CapacityConflict(resource.id(), resource.name(), month,
                            resource.totalQuantity(), allocated, allocations));
                }
            }
        }
        log.debug("Detected {} capacity conflict(s) across {} project(s), {} to {}",
                conflicts.size(), claiming.size(), first, last);
        return conflicts;
    }

    /**
     * What-if check: the capacity conflicts adding {@code candidate} to the portfolio would take part in.
     * Conflicts among the existing projects alone are not reported.
     */
    public List<CapacityConflict> checkProjectConflicts(Project candidate, List<Project> existing,
                                                        List<ResourcePoolItem> resourcePool) {
        var combined = new ArrayList<>(existing);
        combined.add(candidate);
        List<CapacityConflict> conflicts = detectCapacityConflicts(combined, resourcePool).stream()
                .filter(c -> c.involves(candidate.id()))
                .toList();
        log.info("Project {} would take part in {} capacity conflict(s)", candidate.id(), conflicts.size());
        return conflicts;
    }

    /**
     * Remaining capacity of one resource for each month from {@code from} to {@code to}, inclusive.
     *
     * @return empty when the resource is not pooled or {@code to} precedes {@code from}
     */
    public List<ResourceAvailability> resourceAvailability(String resourceId, YearMonth from, YearMonth to,
                                                           List<Project> projects,
                                                           List<ResourcePoolItem> resourcePool) {
        Optional<ResourcePoolItem> resource = resourcePool.stream()
                .filter(r -> r.id().equals(resourceId))
                .findFirst();
        if (resource.isEmpty() || to.isBefore(from)) {
            return List.of();
        }
        List<Project> claiming = projects.stream().filter(CapacityPlanner::claimsCapacity).toList();

        var availability = new ArrayList<ResourceAvailability>();
        for (YearMonth month = from; !month.isAfter(to); month = month.plusMonths(1)) {
            int allocated = allocations(resourceId, month, claiming).stream()
                    .mapToInt(ProjectAllocation::allocation)
                    .sum();
            availability.add(new ResourceAvailability(month, resource.get().totalQuantity(), allocated));
        }
        return availability;
    }

    private static List<ProjectAllocation> allocations(String resourceId, YearMonth month, List<Project> projects) {
        var allocations = new ArrayList<ProjectAllocation>();
        for (Project project : projects) {
            if (!overlaps(project, month)) continue;
            int count = 0;
            for (ResourceRequirement requirement : project.requirementsOrEmpty()) {
                if (resourceId.equals(requirement.resourceId())) {
                    count += requirement.count();
                }
            }
            if (count > 0) {
                allocations.add(new ProjectAllocation(project.id(), project.name(), count));
            }
        }
        return allocations;
    }

    private static boolean overlaps(Project project, YearMonth month) {
        return !project.startDate().isAfter(month.atEndOfMonth())
                && !project.endDate().isBefore(month.atDay(1));
    }

    private static boolean claimsCapacity(Project project) {
        return project.status() != ProjectStatus.COMPLETED && project.status() != ProjectStatus.CANCELLED
                && project.startDate() != null && project.endDate() != null;
    }
}

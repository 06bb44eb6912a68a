package com.chronoplan.core.portfolio;

import com.chronoplan.core.model.Portfolio;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ResourcePoolItem;
import com.chronoplan.core.model.ResourceRequirement;
import com.chronoplan.core.model.Task;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ingestion-time checks. The scheduling algorithms assume input that passed these.
 */
@Service
public class PortfolioValidator {

    /**
     * @throws InvalidPortfolioException listing every violation found
     */
    public void validate(Portfolio portfolio) {
        List<String> violations = new ArrayList<>();

        Set<String> projectIds = new HashSet<>();
        for (Project project : portfolio.projectsOrEmpty()) {
            String label = "project " + project.id();
            if (isBlank(project.id())) {
                violations.add("project with blank id");
                label = "project '" + project.name() + "'";
            } else if (!projectIds.add(project.id())) {
                violations.add("duplicate project id " + project.id());
            }
            if (project.status() == null) {
                violations.add(label + " has no status");
            }
            if (project.startDate() == null || project.endDate() == null) {
                violations.add(label + " is missing a start or end date");
            } else if (project.endDate().isBefore(project.startDate())) {
                violations.add(label + " ends before it starts");
            }
            for (ResourceRequirement requirement : project.requirementsOrEmpty()) {
                if (isBlank(requirement.resourceId())) {
                    violations.add(label + " has a resource requirement without a resource id");
                }
                if (requirement.count() < 0) {
                    violations.add(label + " requires a negative count of " + requirement.resourceId());
                }
            }
            validateTasks(label, project.tasksOrEmpty(), violations);
        }

        Set<String> resourceIds = new HashSet<>();
        for (ResourcePoolItem resource : portfolio.resourcePoolOrEmpty()) {
            if (isBlank(resource.id())) {
                violations.add("resource with blank id");
            } else if (!resourceIds.add(resource.id())) {
                violations.add("duplicate resource id " + resource.id());
            }
            if (resource.totalQuantity() <= 0) {
                violations.add("resource " + resource.id() + " has non-positive capacity " + resource.totalQuantity());
            }
        }

        if (!violations.isEmpty()) {
            throw new InvalidPortfolioException(violations);
        }
    }

    /**
     * @throws InvalidPortfolioException listing every violation found
     */
    public void validateTasks(List<Task> tasks) {
        List<String> violations = new ArrayList<>();
        validateTasks("task set", tasks, violations);
        if (!violations.isEmpty()) {
            throw new InvalidPortfolioException(violations);
        }
    }

    private void validateTasks(String owner, List<Task> tasks, List<String> violations) {
        Set<String> taskIds = new HashSet<>();
        for (Task task : tasks) {
            if (isBlank(task.id())) {
                violations.add(owner + " has a task with blank id");
                continue;
            }
            if (!taskIds.add(task.id())) {
                violations.add(owner + " has duplicate task id " + task.id());
            }
            if (task.startDate() == null || task.endDate() == null) {
                violations.add("task " + task.id() + " is missing a start or end date");
            } else if (task.endDate().isBefore(task.startDate())) {
                violations.add("task " + task.id() + " ends before it starts");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

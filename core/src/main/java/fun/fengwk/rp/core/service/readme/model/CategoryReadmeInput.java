package fun.fengwk.rp.core.service.readme.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Inputs for drafting the README of one component category.
 *
 * @author fengwk
 */
@Data
@Builder
public class CategoryReadmeInput {

    /**
     * Components of the category, usually produced by category extraction.
     */
    private List<Object> categoryInfo;

    /**
     * Markdown template whose structure the README follows.
     */
    private String readmeTemplate;

    private List<String> screenshotLinks;

}

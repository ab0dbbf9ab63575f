package com.schemaid.describe;

import com.schemaid.exception.UnsupportedSchemaNodeException;
import com.schemaid.model.BehaviorHandle;

import java.util.List;

/**
 * Source of model structure and attached behavior. This is the boundary to whatever defines the
 * models; {@link ReflectiveModelDescriptionProvider} is the adapter over plain Java classes.
 */
public interface ModelDescriptionProvider {

    /**
     * Describes one model without expanding the models it references.
     *
     * @throws UnsupportedSchemaNodeException if the model uses a construct that cannot be
     *                                        described faithfully
     */
    ModelDescription describe(Class<?> model);

    /**
     * Validators and serializers attached to the whole model, in execution order.
     */
    List<BehaviorHandle> listModelBehaviors(Class<?> model);

    /**
     * Validators and serializers attached to one field, in execution order.
     */
    List<BehaviorHandle> listFieldBehaviors(Class<?> model, String fieldName);
}

/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openflowopt.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openflowopt.model.EffectCollectionModel;

import java.util.*;

/**
 * The effects of a flow system. At most one of them is the standard effect and at most one is the
 * objective.
 */
public class EffectCollection extends AbstractElement<EffectCollectionModel> {

    public static final String LABEL = "Effects";

    private final Map<String, Effect> effects = new LinkedHashMap<>();

    public EffectCollection() {
        super(LABEL);
    }

    public EffectCollection(Collection<Effect> effects) {
        this();
        Objects.requireNonNull(effects).forEach(this::add);
    }

    public EffectCollection add(Effect effect) {
        Objects.requireNonNull(effect);
        if (effects.containsKey(effect.getLabel())) {
            throw new PowsyblException("Effect '" + effect.getLabel() + "' already added");
        }
        if (effect.isStandard() && getStandardEffect().isPresent()) {
            throw new PowsyblException("A standard effect is already defined: '" + getStandardEffect().get().getLabel() + "'");
        }
        if (effect.isObjective() && getObjectiveEffect().isPresent()) {
            throw new PowsyblException("An objective effect is already defined: '" + getObjectiveEffect().get().getLabel() + "'");
        }
        effects.put(effect.getLabel(), effect);
        return this;
    }

    public Collection<Effect> getEffects() {
        return Collections.unmodifiableCollection(effects.values());
    }

    public Optional<Effect> getEffect(String label) {
        return Optional.ofNullable(effects.get(label));
    }

    public boolean contains(Effect effect) {
        return effects.get(effect.getLabel()) == effect;
    }

    public Optional<Effect> getStandardEffect() {
        return effects.values().stream().filter(Effect::isStandard).findFirst();
    }

    public Optional<Effect> getObjectiveEffect() {
        return effects.values().stream().filter(Effect::isObjective).findFirst();
    }
}

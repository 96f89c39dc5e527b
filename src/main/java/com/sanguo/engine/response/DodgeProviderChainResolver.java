package com.sanguo.engine.response;

import com.sanguo.engine.resolution.ResolutionContext;
import com.sanguo.engine.resolution.ResolutionResult;
import com.sanguo.engine.resolution.Resolver;
import com.sanguo.engine.resolution.ScratchKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Offers a dodge request to each provider in priority order. Stops as soon
 * as the request is resolved or a provider takes it over. Always succeeds;
 * the attack outcome reads what happened from the request.
 */
public class DodgeProviderChainResolver implements Resolver {
    private static final Logger log = LoggerFactory.getLogger(DodgeProviderChainResolver.class);

    public static final String KIND = "dodge-provider-chain";

    private final DodgeRequestContext request;
    private final List<DodgeProvider> providers;

    public DodgeProviderChainResolver(DodgeRequestContext request) {
        this(request, defaultProviders());
    }

    public DodgeProviderChainResolver(DodgeRequestContext request, List<DodgeProvider> providers) {
        this.request = request;
        List<DodgeProvider> sorted = new ArrayList<>(providers);
        sorted.sort(Comparator.comparingInt(DodgeProvider::priority));
        this.providers = List.copyOf(sorted);
    }

    public static List<DodgeProvider> defaultProviders() {
        return List.of(new ResponseAssistanceProvider(), new JudgementDodgeProvider(), new ManualDodgeProvider());
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        context.requireScratchPad().put(ScratchKeys.DODGE_REQUEST, request);

        for (DodgeProvider provider : providers) {
            if (request.isResolved() || request.isHighPriorityActivated()) {
                break;
            }
            if (!provider.canProvide(context, request)) {
                continue;
            }
            log.debug("Dodge provider {} handling request against seat {}", provider.id(), request.getDefenderSeat());
            provider.provide(context, request);
            if (request.isResolved()) {
                return ResolutionResult.SUCCESS;
            }
            if (request.isHighPriorityActivated()) {
                break;
            }
        }
        return ResolutionResult.SUCCESS;
    }
}

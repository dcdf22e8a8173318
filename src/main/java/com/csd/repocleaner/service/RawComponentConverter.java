package com.csd.repocleaner.service;

import com.csd.repocleaner.model.Asset;
import com.csd.repocleaner.model.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw repositories have no components, so each asset becomes one: the parent folder is the
 * name and the file name is the version. Files at the repository root are left out.
 */
public final class RawComponentConverter {

    private RawComponentConverter() {}

    public static List<Component> fromAssets(List<Asset> assets) {
        List<Component> components = new ArrayList<>();
        if (assets == null) return components;
        for (Asset asset : assets) {
            if (asset == null) continue;
            String path = asset.getPath();
            if (path == null || path.isEmpty() || !path.contains("/")) continue;

            int slash = path.lastIndexOf('/');
            String folder = path.substring(0, slash);
            String file = path.substring(slash + 1);
            if (file.isEmpty()) continue;

            components.add(Component.builder()
                    .id(asset.getId())
                    .repository(asset.getRepository())
                    .format(asset.getFormat())
                    .name(folder.isEmpty() ? "/" : folder)
                    .version(file)
                    .assets(List.of(asset))
                    .build());
        }
        return components;
    }
}

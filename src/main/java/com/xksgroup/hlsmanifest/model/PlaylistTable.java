package com.xksgroup.hlsmanifest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Playlist lookup for a manifest, addressable by position, by id and by uri.
 * <p>
 * The positional index only holds the top-level variant playlists. Nested
 * rendition playlists are reachable by id and uri only. Whatever key an entry
 * is registered under, every index returns the same instance for it.
 * <p>
 * Serialized as the plain ordered list of top-level playlists.
 */
public class PlaylistTable implements Iterable<MediaPlaylist> {

    private final List<MediaPlaylist> byIndex = new ArrayList<>();
    private final Map<String, MediaPlaylist> byId = new HashMap<>();
    private final Map<String, MediaPlaylist> byUri = new HashMap<>();

    public PlaylistTable() {
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public PlaylistTable(List<MediaPlaylist> playlists) {
        if (playlists != null) {
            byIndex.addAll(playlists);
        }
    }

    public void add(MediaPlaylist playlist) {
        byIndex.add(playlist);
    }

    public MediaPlaylist get(int index) {
        return byIndex.get(index);
    }

    public int size() {
        return byIndex.size();
    }

    public boolean isEmpty() {
        return byIndex.isEmpty();
    }

    /**
     * Registers a playlist under its current id and uri. Either key may be
     * null, in which case that index is left untouched.
     */
    public void register(MediaPlaylist playlist) {
        if (playlist.getId() != null) {
            byId.put(playlist.getId(), playlist);
        }
        if (playlist.getUri() != null) {
            byUri.put(playlist.getUri(), playlist);
        }
    }

    public MediaPlaylist getById(String id) {
        return byId.get(id);
    }

    public MediaPlaylist getByUri(String uri) {
        return byUri.get(uri);
    }

    public Map<String, MediaPlaylist> idIndex() {
        return Collections.unmodifiableMap(byId);
    }

    public Map<String, MediaPlaylist> uriIndex() {
        return Collections.unmodifiableMap(byUri);
    }

    @JsonValue
    public List<MediaPlaylist> asList() {
        return Collections.unmodifiableList(byIndex);
    }

    @Override
    public Iterator<MediaPlaylist> iterator() {
        return asList().iterator();
    }
}

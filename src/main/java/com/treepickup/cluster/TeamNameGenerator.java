package com.treepickup.cluster;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Team names from the NATO phonetic alphabet: "Team Alpha" through
 * "Team Zulu", then "Team Alpha 2" and so on
 */
@Component
public class TeamNameGenerator {

    private static final List<String> NATO_ALPHABET = List.of(
            "Alpha", "Bravo", "Charlie", "Delta", "Echo", "Foxtrot", "Golf",
            "Hotel", "India", "Juliet", "Kilo", "Lima", "Mike", "November",
            "Oscar", "Papa", "Quebec", "Romeo", "Sierra", "Tango", "Uniform",
            "Victor", "Whiskey", "X-ray", "Yankee", "Zulu");

    public List<String> generate(int count) {
        List<String> names = new ArrayList<>(Math.max(count, 0));
        for (int i = 0; i < count; i++) {
            int cycle = i / NATO_ALPHABET.size();
            String word = NATO_ALPHABET.get(i % NATO_ALPHABET.size());
            names.add(cycle == 0 ? "Team " + word : "Team " + word + " " + (cycle + 1));
        }
        return names;
    }
}

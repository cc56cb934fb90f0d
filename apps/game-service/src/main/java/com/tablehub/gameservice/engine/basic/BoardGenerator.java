package com.tablehub.gameservice.engine.basic;

import com.tablehub.gameservice.engine.core.BoardTile;
import com.tablehub.gameservice.engine.core.Resource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 棋盘生成器：半径 2 的六边形棋盘，共 19 块地块。
 * 资源与点数各自用 {@code new Random(seed)} 洗牌，同一种子永远得到同一棋盘。
 */
@Component
public class BoardGenerator {

    public static final int RADIUS = 2;
    public static final int TILE_COUNT = 19;

    /** 18 块资源地 + 1 块沙漠（null） */
    private static final List<Resource> TILE_RESOURCES;
    /** 18 个点数，7 不出现在地块上 */
    private static final List<Integer> TILE_NUMBERS = List.of(
            2, 3, 3, 4, 4, 5, 5, 6, 6, 8, 8, 9, 9, 10, 10, 11, 11, 12);
    private static final List<int[]> COORDINATES = spiral(RADIUS);

    static {
        List<Resource> pool = new ArrayList<>();
        addN(pool, Resource.WOOD, 4);
        addN(pool, Resource.BRICK, 3);
        addN(pool, Resource.SHEEP, 4);
        addN(pool, Resource.WHEAT, 4);
        addN(pool, Resource.ORE, 3);
        pool.add(null);
        TILE_RESOURCES = Collections.unmodifiableList(pool);
    }

    public List<BoardTile> generate(long seed) {
        Random rng = new Random(seed);
        List<Resource> resources = new ArrayList<>(TILE_RESOURCES);
        List<Integer> numbers = new ArrayList<>(TILE_NUMBERS);
        Collections.shuffle(resources, rng);
        Collections.shuffle(numbers, rng);

        List<BoardTile> tiles = new ArrayList<>(TILE_COUNT);
        int n = 0;
        for (int i = 0; i < COORDINATES.size(); i++) {
            int[] c = COORDINATES.get(i);
            Resource r = resources.get(i);
            Integer number = r == null ? null : numbers.get(n++);
            tiles.add(new BoardTile(c[0], c[1], c[2], r, number));
        }
        return tiles;
    }

    private static void addN(List<Resource> pool, Resource r, int n) {
        for (int i = 0; i < n; i++) {
            pool.add(r);
        }
    }

    /** 立方坐标：中心、第 1 圈、第 2 圈 */
    private static List<int[]> spiral(int radius) {
        int[][] dirs = {{1, -1, 0}, {1, 0, -1}, {0, 1, -1}, {-1, 1, 0}, {-1, 0, 1}, {0, -1, 1}};
        List<int[]> out = new ArrayList<>();
        out.add(new int[]{0, 0, 0});
        for (int k = 1; k <= radius; k++) {
            int[] cur = {dirs[4][0] * k, dirs[4][1] * k, dirs[4][2] * k};
            for (int side = 0; side < 6; side++) {
                for (int step = 0; step < k; step++) {
                    out.add(cur.clone());
                    cur = new int[]{cur[0] + dirs[side][0], cur[1] + dirs[side][1], cur[2] + dirs[side][2]};
                }
            }
        }
        return Collections.unmodifiableList(out);
    }
}
